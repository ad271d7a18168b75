package in.heauton.infrastructure.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-process LRU cache split into independent regions.
 *
 * Each region holds at most {@code capacityPerRegion} entries and evicts its
 * least recently used entry on overflow. Regions never share capacity, so a
 * burst of quote lookups cannot push schedules out.
 */
public final class BoundedCache {
    private static final Logger log = LoggerFactory.getLogger(BoundedCache.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacityPerRegion;
    private final ConcurrentMap<CacheRegion<?>, LruPartition<String, Object>> partitions = new ConcurrentHashMap<>();

    public BoundedCache() {
        this(DEFAULT_CAPACITY);
    }

    public BoundedCache(int capacityPerRegion) {
        if (capacityPerRegion < 1) {
            throw new IllegalArgumentException("capacityPerRegion must be >= 1, was " + capacityPerRegion);
        }
        this.capacityPerRegion = capacityPerRegion;
    }

    public int capacityPerRegion() {
        return capacityPerRegion;
    }

    public <V> void put(CacheRegion<V> region, String key, V value) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Cache key and value must not be null");
        }
        String evicted = partition(region).put(key, value);
        if (evicted != null) {
            log.debug("Evicted {} from cache region {}", evicted, region);
        }
    }

    /**
     * Invalidation generation of a region. Read it before loading a value
     * from the store and pass it to {@link #putIfNotInvalidated}.
     */
    public <V> long generation(CacheRegion<V> region) {
        return partition(region).generation();
    }

    /**
     * Cache a value loaded from the store unless the region saw a remove or
     * clear after {@code generation} was read.
     *
     * @return true when the value was cached
     */
    public <V> boolean putIfNotInvalidated(CacheRegion<V> region, String key, V value, long generation) {
        if (key == null || value == null) {
            throw new IllegalArgumentException("Cache key and value must not be null");
        }
        boolean stored = partition(region).putIfGeneration(key, value, generation);
        if (!stored) {
            log.debug("Dropped load of {} in cache region {}: invalidated meanwhile", key, region);
        }
        return stored;
    }

    public <V> Optional<V> get(CacheRegion<V> region, String key) {
        if (key == null) {
            return Optional.empty();
        }
        Object value = partition(region).get(key);
        return Optional.ofNullable(value).map(region.valueType()::cast);
    }

    public <V> boolean contains(CacheRegion<V> region, String key) {
        return key != null && partition(region).containsKey(key);
    }

    public <V> void remove(CacheRegion<V> region, String key) {
        if (key != null) {
            partition(region).remove(key);
        }
    }

    public <V> void clear(CacheRegion<V> region) {
        partition(region).clear();
        log.debug("Cleared cache region {}", region);
    }

    public void clearAll() {
        partitions.values().forEach(LruPartition::clear);
        log.info("Cleared all cache regions");
    }

    public <V> CacheStats stats(CacheRegion<V> region) {
        return partition(region).stats();
    }

    /**
     * Stats for every region touched so far, ordered by region name.
     */
    public List<CacheStats> allStats() {
        List<CacheStats> result = new ArrayList<>();
        partitions.values().forEach(p -> result.add(p.stats()));
        result.sort(Comparator.comparing(CacheStats::region));
        return result;
    }

    private LruPartition<String, Object> partition(CacheRegion<?> region) {
        return partitions.computeIfAbsent(region, r -> new LruPartition<>(r.name(), capacityPerRegion));
    }
}
