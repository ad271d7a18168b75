package in.heauton.infrastructure.cache;

/**
 * Point-in-time counters for one cache region.
 */
public record CacheStats(
        String region,
        int size,
        int maxSize,
        long hits,
        long misses,
        long puts,
        long evictions) {

    public double hitRate() {
        long lookups = hits + misses;
        return lookups > 0 ? (double) hits / lookups : 0.0;
    }

    @Override
    public String toString() {
        return String.format("%s: size=%d/%d, hits=%d, misses=%d, hitRate=%.2f%%, puts=%d, evictions=%d",
                region, size, maxSize, hits, misses, hitRate() * 100, puts, evictions);
    }
}
