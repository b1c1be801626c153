package net.vortexdevelopment.vattribute.cache;

import java.util.function.Function;

/**
 * Storage behind memoizing analyzers.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public interface Cache<K, V> {

    /**
     * Get a value from the cache.
     *
     * @param key the key
     * @return the value, or null if not found
     */
    V get(K key);

    /**
     * Put a value into the cache, replacing any previous value.
     */
    void put(K key, V value);

    /**
     * Return the cached value, computing and storing it on a miss. The loader runs outside any lock,
     * so concurrent misses for one key may each compute; the last write wins.
     */
    default V get(K key, Function<? super K, ? extends V> loader) {
        V value = get(key);
        if (value == null) {
            value = loader.apply(key);
            put(key, value);
        }
        return value;
    }

    boolean contains(K key);

    void invalidate();

    int size();

    long getHits();

    long getMisses();
}
