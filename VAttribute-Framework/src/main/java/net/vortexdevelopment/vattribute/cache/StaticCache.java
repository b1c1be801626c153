package net.vortexdevelopment.vattribute.cache;

import net.vortexdevelopment.vattribute.debug.DebugLogger;
import org.jetbrains.annotations.Nullable;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache that never evicts. Analyzed structures are assumed immutable for the lifetime of the process.
 */
public class StaticCache<K, V> implements Cache<K, V> {

    private final Map<K, CacheEntry<V>> storage = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong(0);
    private final AtomicLong misses = new AtomicLong(0);

    @Override
    public V get(K key) {
        CacheEntry<V> entry = storage.get(key);
        if (entry != null) {
            hits.incrementAndGet();
            entry.markAccessed();
            DebugLogger.log(StaticCache.class, "Cache HIT for key: %s", key);
            return entry.getValue();
        }
        misses.incrementAndGet();
        DebugLogger.log(StaticCache.class, "Cache MISS for key: %s", key);
        return null;
    }

    @Override
    public void put(K key, V value) {
        DebugLogger.log(StaticCache.class, "Caching entry for key: %s", key);
        storage.put(key, new CacheEntry<>(value));
    }

    @Override
    public boolean contains(K key) {
        return storage.containsKey(key);
    }

    @Nullable
    public CacheEntry<V> getEntry(K key) {
        return storage.get(key);
    }

    @Override
    public void invalidate() {
        DebugLogger.log(StaticCache.class, "Invalidating all %d entries", storage.size());
        storage.clear();
    }

    @Override
    public int size() {
        return storage.size();
    }

    @Override
    public long getHits() {
        return hits.get();
    }

    @Override
    public long getMisses() {
        return misses.get();
    }
}
