package ai.ideaforge.sim.config;

import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        boolean mockMode,
        AppEnvironment environment,
        MockServiceConfig mockServiceConfig,
        LogFormat logFormat,
        ModelConfig modelConfig,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(mockServiceConfig, "mockServiceConfig");
        Objects.requireNonNull(logFormat, "logFormat");
        Objects.requireNonNull(modelConfig, "modelConfig");
        secrets = secrets == null ? Secrets.none() : secrets;
    }

    public boolean isProduction() {
        return environment == AppEnvironment.PRODUCTION;
    }
}
