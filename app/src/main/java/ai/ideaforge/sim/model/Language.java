package ai.ideaforge.sim.model;

/**
 * Response language of a service call and of the fixture that backs it.
 */
public enum Language {
    EN("en"),
    ES("es");

    private final String code;

    Language(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Language from(String raw) {
        if (raw == null || raw.isBlank()) {
            return EN;
        }
        String normalized = raw.trim();
        for (Language language : values()) {
            if (language.code.equalsIgnoreCase(normalized) || language.name().equalsIgnoreCase(normalized)) {
                return language;
            }
        }
        throw new IllegalArgumentException("Unsupported language: " + raw);
    }
}
