package in.heauton.infrastructure.cache;

import in.heauton.domain.model.Quote;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedCacheTest {

    private static final CacheRegion<String> NAMES = new CacheRegion<>("names", String.class);
    private static final CacheRegion<String> OTHER = new CacheRegion<>("other", String.class);

    @Test
    void put_evictsLeastRecentlyUsedWhenFull() {
        BoundedCache cache = new BoundedCache(3);
        cache.put(NAMES, "a", "A");
        cache.put(NAMES, "b", "B");
        cache.put(NAMES, "c", "C");

        // touch "a" so "b" becomes the eldest
        cache.get(NAMES, "a");
        cache.put(NAMES, "d", "D");

        assertTrue(cache.contains(NAMES, "a"));
        assertFalse(cache.contains(NAMES, "b"));
        assertTrue(cache.contains(NAMES, "c"));
        assertTrue(cache.contains(NAMES, "d"));
        assertTrue(cache.get(NAMES, "b").isEmpty());
        assertEquals(1, cache.stats(NAMES).evictions());
    }

    @Test
    void put_existingKeyReplacesWithoutEvicting() {
        BoundedCache cache = new BoundedCache(2);
        cache.put(NAMES, "a", "A");
        cache.put(NAMES, "b", "B");

        cache.put(NAMES, "a", "A2");

        assertEquals("A2", cache.get(NAMES, "a").orElseThrow());
        assertTrue(cache.contains(NAMES, "b"));
        assertEquals(0, cache.stats(NAMES).evictions());
        assertEquals(2, cache.stats(NAMES).size());
    }

    @Test
    void put_existingKeyPromotesIt() {
        BoundedCache cache = new BoundedCache(2);
        cache.put(NAMES, "a", "A");
        cache.put(NAMES, "b", "B");
        cache.put(NAMES, "a", "A2");

        cache.put(NAMES, "c", "C");

        assertTrue(cache.contains(NAMES, "a"));
        assertFalse(cache.contains(NAMES, "b"));
    }

    @Test
    void regions_haveIndependentCapacity() {
        BoundedCache cache = new BoundedCache(2);
        cache.put(OTHER, "x", "X");
        for (int i = 0; i < 10; i++) {
            cache.put(NAMES, "k" + i, "v" + i);
        }

        assertTrue(cache.contains(OTHER, "x"));
        assertEquals(2, cache.stats(NAMES).size());
        assertEquals(8, cache.stats(NAMES).evictions());
    }

    @Test
    void stats_countHitsMissesAndPuts() {
        BoundedCache cache = new BoundedCache();
        cache.put(NAMES, "a", "A");
        cache.get(NAMES, "a");
        cache.get(NAMES, "a");
        cache.get(NAMES, "missing");

        CacheStats stats = cache.stats(NAMES);

        assertEquals(2, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.puts());
        assertEquals(BoundedCache.DEFAULT_CAPACITY, stats.maxSize());
        assertEquals(2.0 / 3.0, stats.hitRate(), 1e-9);
    }

    @Test
    void stats_hitRateIsZeroWithoutLookups() {
        assertEquals(0.0, new BoundedCache().stats(NAMES).hitRate());
    }

    @Test
    void remove_clear_and_clearAll() {
        BoundedCache cache = new BoundedCache();
        cache.put(NAMES, "a", "A");
        cache.put(NAMES, "b", "B");
        cache.put(OTHER, "x", "X");

        cache.remove(NAMES, "a");
        assertFalse(cache.get(NAMES, "a").isPresent());

        cache.clear(NAMES);
        assertFalse(cache.contains(NAMES, "b"));
        assertTrue(cache.contains(OTHER, "x"));

        cache.clearAll();
        assertFalse(cache.contains(OTHER, "x"));
    }

    @Test
    void putIfNotInvalidated_dropsValueLoadedBeforeRemove() {
        // Arrange
        BoundedCache cache = new BoundedCache();
        long generation = cache.generation(NAMES);

        // Act: an invalidation lands between the load and the put
        cache.remove(NAMES, "a");
        boolean stored = cache.putIfNotInvalidated(NAMES, "a", "stale", generation);

        // Assert
        assertFalse(stored);
        assertTrue(cache.get(NAMES, "a").isEmpty());
    }

    @Test
    void putIfNotInvalidated_storesWhenRegionUntouched() {
        BoundedCache cache = new BoundedCache();
        cache.put(NAMES, "b", "B");
        long generation = cache.generation(NAMES);

        assertTrue(cache.putIfNotInvalidated(NAMES, "a", "A", generation));
        assertEquals("A", cache.get(NAMES, "a").orElseThrow());
    }

    @Test
    void generation_isPerRegionAndBumpedByClear() {
        BoundedCache cache = new BoundedCache();
        long names = cache.generation(NAMES);
        long other = cache.generation(OTHER);

        cache.clear(OTHER);

        assertEquals(names, cache.generation(NAMES));
        assertNotEquals(other, cache.generation(OTHER));
        assertFalse(cache.putIfNotInvalidated(OTHER, "x", "X", other));
    }

    @Test
    void typedRegion_returnsDomainValues() {
        BoundedCache cache = new BoundedCache();
        Quote quote = new Quote("q1", "text", "author", Set.of("calm"), false);
        cache.put(CacheRegion.QUOTES, "q1", quote);

        Quote cached = cache.get(CacheRegion.QUOTES, "q1").orElseThrow();

        assertEquals(quote, cached);
        assertEquals(List.of("quote"), cache.allStats().stream().map(CacheStats::region).toList());
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedCache(0));
    }

    @Test
    void concurrentAccess_neverExceedsCapacity() throws Exception {
        BoundedCache cache = new BoundedCache(16);
        int threads = 8;
        int opsPerThread = 2_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int seed = t;
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < opsPerThread; i++) {
                    String key = "k" + ((seed * 31 + i) % 64);
                    cache.put(NAMES, key, key);
                    cache.get(NAMES, key);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        CacheStats stats = cache.stats(NAMES);
        assertTrue(stats.size() <= 16);
        assertEquals((long) threads * opsPerThread, stats.puts());
        assertEquals((long) threads * opsPerThread, stats.hits() + stats.misses());
    }
}
