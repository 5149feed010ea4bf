package ai.ideaforge.sim.model;

final class Scores {

    static final int MIN = 0;
    static final int MAX = 100;

    private Scores() {
    }

    static int requireScore(int value, String field) {
        if (value < MIN || value > MAX) {
            throw new IllegalArgumentException(field + " must be between " + MIN + " and " + MAX + " but was " + value);
        }
        return value;
    }

    static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
