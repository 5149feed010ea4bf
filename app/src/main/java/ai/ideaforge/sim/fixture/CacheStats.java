package ai.ideaforge.sim.fixture;

/**
 * Counters of the fixture cache since construction or the last {@link TestDataManager#clearCache()}.
 */
public record CacheStats(long hits, long misses, int size) {

    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
