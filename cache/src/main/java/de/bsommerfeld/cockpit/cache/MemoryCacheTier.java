package de.bsommerfeld.cockpit.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

import java.util.Optional;

/**
 * Bounded fast tier. Backed by a single-segment Guava cache so that eviction
 * under capacity pressure follows least-recently-used order across all keys.
 * Evictions are silent.
 */
public class MemoryCacheTier {

    private final Cache<String, CacheEntry> entries;
    private final int capacity;

    public MemoryCacheTier(int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
        this.entries = CacheBuilder.newBuilder()
                .maximumSize(capacity)
                .concurrencyLevel(1)
                .build();
    }

    /**
     * Looks up an entry and marks it as recently used. Expiry is not checked
     * here; the facade decides what to do with a lapsed entry.
     */
    public Optional<CacheEntry> get(String key) {
        return Optional.ofNullable(entries.getIfPresent(key));
    }

    public void put(String key, CacheEntry entry) {
        entries.put(key, entry);
    }

    public void invalidate(String key) {
        entries.invalidate(key);
    }

    public void invalidateAll() {
        entries.invalidateAll();
    }

    public long size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
