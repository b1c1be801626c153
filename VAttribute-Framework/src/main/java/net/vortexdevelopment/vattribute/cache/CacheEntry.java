package net.vortexdevelopment.vattribute.cache;

import lombok.Getter;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wrapper for cached values with access metadata.
 */
@Getter
public class CacheEntry<T> {
    private final T value;
    private final long created;
    private volatile long lastAccess;
    private final AtomicInteger accessCount;

    public CacheEntry(T value) {
        this.value = value;
        this.created = System.currentTimeMillis();
        this.lastAccess = created;
        this.accessCount = new AtomicInteger(0);
    }

    /**
     * Mark this entry as accessed, updating timestamp and incrementing counter.
     */
    public void markAccessed() {
        this.lastAccess = System.currentTimeMillis();
        this.accessCount.incrementAndGet();
    }
}
