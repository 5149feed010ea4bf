package ai.ideaforge.sim.config;

import java.util.Locale;

/**
 * Deployment environment the process runs in.
 */
public enum AppEnvironment {
    DEVELOPMENT,
    TEST,
    PRODUCTION;

    public static AppEnvironment from(String raw) {
        if (raw == null || raw.isBlank()) {
            return DEVELOPMENT;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "development", "dev" -> DEVELOPMENT;
            case "test" -> TEST;
            case "production", "prod" -> PRODUCTION;
            default -> throw new IllegalArgumentException("Unsupported environment: " + raw);
        };
    }
}
