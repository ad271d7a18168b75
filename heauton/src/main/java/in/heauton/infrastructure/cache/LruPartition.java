package in.heauton.infrastructure.cache;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity least-recently-used map guarded by a single lock.
 *
 * Every operation holds the partition lock, so reads (which reorder the
 * access list) and writes are linearizable with respect to each other.
 */
final class LruPartition<K, V> {
    private final String name;
    private final int maxEntries;
    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<K, V> entries = new LinkedHashMap<>(16, 0.75f, true);

    // Bumped by every remove and clear
    private long generation;

    private long hits;
    private long misses;
    private long puts;
    private long evictions;

    LruPartition(String name, int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, was " + maxEntries);
        }
        this.name = name;
        this.maxEntries = maxEntries;
    }

    V get(K key) {
        lock.lock();
        try {
            V value = entries.get(key);
            if (value != null) {
                hits++;
            } else {
                misses++;
            }
            return value;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store {@code value}, evicting the eldest entry when the partition is full.
     *
     * @return the evicted key, or null when nothing was evicted
     */
    K put(K key, V value) {
        lock.lock();
        try {
            puts++;
            entries.put(key, value);
            if (entries.size() <= maxEntries) {
                return null;
            }
            Iterator<Map.Entry<K, V>> eldest = entries.entrySet().iterator();
            K evicted = eldest.next().getKey();
            eldest.remove();
            evictions++;
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store {@code value} only if nothing was invalidated since {@code expectedGeneration}
     * was read.
     *
     * @return false when the value was dropped as possibly stale
     */
    boolean putIfGeneration(K key, V value, long expectedGeneration) {
        lock.lock();
        try {
            if (generation != expectedGeneration) {
                return false;
            }
            put(key, value);
            return true;
        } finally {
            lock.unlock();
        }
    }

    long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    V remove(K key) {
        lock.lock();
        try {
            generation++;
            return entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    boolean containsKey(K key) {
        lock.lock();
        try {
            // containsKey does not touch access order
            return entries.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            generation++;
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(name, entries.size(), maxEntries, hits, misses, puts, evictions);
        } finally {
            lock.unlock();
        }
    }
}
