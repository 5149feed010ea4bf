package ai.ideaforge.sim.fixture;

import ai.ideaforge.sim.model.Language;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * Immutable example payload of a successful call. The JSON tree never leaves this object; callers work on copies.
 */
public final class Fixture {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final FixtureType type;
    private final Language language;
    private final ObjectNode root;

    Fixture(FixtureType type, Language language, ObjectNode root) {
        this.type = Objects.requireNonNull(type, "type");
        this.language = Objects.requireNonNull(language, "language");
        this.root = Objects.requireNonNull(root, "root").deepCopy();
    }

    public FixtureType type() {
        return type;
    }

    public Language language() {
        return language;
    }

    public ObjectNode mutableCopy() {
        return root.deepCopy();
    }

    public boolean has(String key) {
        return root.hasNonNull(key);
    }

    public String text(String key) {
        return root.path(key).asText("");
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialize " + type + " fixture", ex);
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Fixture fixture)) {
            return false;
        }
        return type == fixture.type && language == fixture.language && root.equals(fixture.root);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, language, root);
    }

    @Override
    public String toString() {
        return "Fixture[" + type + "/" + language.code() + "]";
    }
}
