package ai.ideaforge.sim.model;

/**
 * Flavour of mashup: combine companies/products, or combine AWS services.
 */
public enum FrankensteinMode {
    COMPANIES,
    AWS;

    public static FrankensteinMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return COMPANIES;
        }
        for (FrankensteinMode mode : values()) {
            if (mode.name().equalsIgnoreCase(raw.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported Frankenstein mode: " + raw);
    }
}
