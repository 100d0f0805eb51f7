package de.bsommerfeld.cockpit.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Two-level cache: a bounded {@link MemoryCacheTier} in front of an optional
 * {@link DurableCacheStore}.
 *
 * <h2>Read path</h2>
 * <ol>
 * <li>Memory hit, not expired: decode and return.</li>
 * <li>Memory hit, expired: evict from memory and fall through.</li>
 * <li>Durable hit, not expired: promote into memory, decode and return.</li>
 * <li>Durable hit, expired: delete the row and fail with
 * {@link CacheException.Reason#EXPIRED}.</li>
 * <li>Nothing anywhere: fail with {@link CacheException.Reason#NOT_FOUND}.</li>
 * </ol>
 *
 * <h2>Locking</h2>
 * The tiers are guarded together by one read/write lock. {@code set},
 * {@code delete}, {@code clear} and {@code cleanupExpired} take the write
 * lock; reads take the read lock, which keeps a concurrent promotion from
 * resurrecting an entry that a writer is deleting. Acquisition waits at most
 * the configured timeout and otherwise fails that one call with
 * {@link CacheException.Reason#LOCK}. Decoding happens outside the lock.
 */
public class TieredCache {

    private static final Logger LOG = LoggerFactory.getLogger(TieredCache.class);

    public static final int DEFAULT_MEMORY_CAPACITY = 100;
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final MemoryCacheTier memory;
    private final DurableCacheStore durable;
    private final CacheSerializer serializer;
    private final Clock clock;
    private final Duration lockTimeout;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * Memory-only cache with default capacity and lock timeout.
     */
    public TieredCache() {
        this(DEFAULT_MEMORY_CAPACITY, null, Clock.systemUTC(), DEFAULT_LOCK_TIMEOUT);
    }

    /**
     * @param durable slow tier, or {@code null} for a memory-only cache
     */
    public TieredCache(int memoryCapacity, DurableCacheStore durable, Clock clock, Duration lockTimeout) {
        this(new MemoryCacheTier(memoryCapacity), durable, new CacheSerializer(), clock, lockTimeout);
    }

    public TieredCache(MemoryCacheTier memory, DurableCacheStore durable, CacheSerializer serializer, Clock clock,
            Duration lockTimeout) {
        this.memory = memory;
        this.durable = durable;
        this.serializer = serializer;
        this.clock = clock;
        this.lockTimeout = lockTimeout;
        LOG.info("Cache ready (memory capacity {}, durable tier {})", memory.capacity(),
                durable != null ? "enabled" : "disabled");
    }

    public boolean hasDurableTier() {
        return durable != null;
    }

    /**
     * Stores {@code value} in both tiers until {@code now + ttl}.
     *
     * @throws CacheException with {@code SERIALIZATION}, {@code STORAGE} or
     *                        {@code LOCK}
     */
    public void set(String key, Object value, Duration ttl) {
        if (ttl == null || ttl.isNegative())
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);

        byte[] payload = serializer.serialize(key, value);
        CacheEntry entry = new CacheEntry(payload, clock.instant().plus(ttl));

        locked(lock.writeLock(), key, () -> {
            memory.put(key, entry);
            if (durable != null)
                durable.upsert(key, entry);
            return null;
        });
        LOG.debug("Cache set: {} (ttl {})", key, ttl);
    }

    public <T> T get(String key, Class<T> type) {
        return read(key, payload -> serializer.deserialize(key, payload, type));
    }

    public <T> T get(String key, TypeReference<T> type) {
        return read(key, payload -> serializer.deserialize(key, payload, type));
    }

    private <T> T read(String key, Function<byte[], T> decoder) {
        byte[] payload = locked(lock.readLock(), key, () -> lookup(key));
        return decoder.apply(payload);
    }

    private byte[] lookup(String key) {
        Instant now = clock.instant();
        boolean lapsed = false;

        Optional<CacheEntry> cached = memory.get(key);
        if (cached.isPresent()) {
            if (!cached.get().isExpired(now)) {
                LOG.debug("Cache hit (memory): {}", key);
                return cached.get().serializedValue();
            }
            memory.invalidate(key);
            lapsed = true;
        }

        if (durable != null) {
            Optional<CacheEntry> stored = durable.find(key);
            if (stored.isPresent()) {
                CacheEntry entry = stored.get();
                if (!entry.isExpired(now)) {
                    LOG.debug("Cache hit (durable): {}", key);
                    memory.put(key, entry);
                    return entry.serializedValue();
                }
                durable.delete(key);
                lapsed = true;
            }
        }

        if (lapsed) {
            LOG.debug("Cache expired: {}", key);
            throw CacheException.expired(key);
        }
        LOG.debug("Cache miss: {}", key);
        throw CacheException.notFound(key);
    }

    /**
     * Reads whatever is stored under {@code key}, ignoring expiry and leaving
     * both tiers untouched. Meant for showing last-known data when a fresh
     * fetch fails, so every failure is logged and answered with an empty
     * result.
     */
    public <T> Optional<T> getStale(String key, Class<T> type) {
        return readStale(key, payload -> serializer.deserialize(key, payload, type));
    }

    public <T> Optional<T> getStale(String key, TypeReference<T> type) {
        return readStale(key, payload -> serializer.deserialize(key, payload, type));
    }

    private <T> Optional<T> readStale(String key, Function<byte[], T> decoder) {
        try {
            Optional<byte[]> payload = locked(lock.readLock(), key, () -> {
                Optional<CacheEntry> cached = memory.get(key);
                if (cached.isPresent())
                    return Optional.of(cached.get().serializedValue());
                if (durable != null)
                    return durable.find(key).map(CacheEntry::serializedValue);
                return Optional.<byte[]>empty();
            });
            return payload.map(decoder);
        } catch (CacheException e) {
            LOG.warn("Stale read of '{}' failed: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * {@code true} if {@link #get} would currently succeed for {@code key}.
     * Lapsed entries found along the way are removed as {@code get} would.
     */
    public boolean exists(String key) {
        try {
            locked(lock.readLock(), key, () -> lookup(key));
            return true;
        } catch (CacheException e) {
            if (e.isMiss())
                return false;
            throw e;
        }
    }

    /**
     * Removes {@code key} from both tiers. Deleting an absent key is a no-op.
     */
    public void delete(String key) {
        locked(lock.writeLock(), key, () -> {
            memory.invalidate(key);
            if (durable != null)
                durable.delete(key);
            return null;
        });
        LOG.debug("Cache delete: {}", key);
    }

    public void clear() {
        locked(lock.writeLock(), null, () -> {
            memory.invalidateAll();
            if (durable != null)
                durable.clear();
            return null;
        });
        LOG.info("Cache cleared");
    }

    /**
     * Sweeps lapsed rows from the durable tier.
     *
     * @return number of removed rows, always 0 without a durable tier
     */
    public int cleanupExpired() {
        if (durable == null)
            return 0;
        int removed = locked(lock.writeLock(), null, () -> durable.deleteExpired(clock.instant()));
        LOG.debug("Cache cleanup: {} expired entries removed", removed);
        return removed;
    }

    MemoryCacheTier memoryTier() {
        return memory;
    }

    private <T> T locked(Lock l, String key, Supplier<T> action) {
        boolean acquired;
        try {
            acquired = l.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheException(CacheException.Reason.LOCK, key, "Interrupted while waiting for cache lock", e);
        }
        if (!acquired)
            throw new CacheException(CacheException.Reason.LOCK, key,
                    "Cache lock not acquired within " + lockTimeout.toMillis() + " ms");
        try {
            return action.get();
        } finally {
            l.unlock();
        }
    }
}
