package ai.ideaforge.sim.fixture;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Shifts score fields by small input-derived offsets. Each successive field gets its own offset.
 */
final class ScoreJitter {

    static final int SCORE_SPREAD = 6;
    static final int FIT_SPREAD = 1;

    private final int seed;
    private int position;

    ScoreJitter(int seed) {
        this.seed = seed;
    }

    void shift(JsonNode node, String field, int spread, int max) {
        if (!(node instanceof ObjectNode objectNode) || !objectNode.path(field).isNumber()) {
            return;
        }
        int value = objectNode.get(field).asInt();
        objectNode.put(field, clamp(value + nextOffset(spread), 0, max));
    }

    int nextOffset(int spread) {
        int mixed = seed * 31 + (position++) * 0x9E3779B9;
        mixed ^= mixed >>> 16;
        return Math.floorMod(mixed, 2 * spread + 1) - spread;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
