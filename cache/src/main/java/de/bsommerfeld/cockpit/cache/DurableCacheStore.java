package de.bsommerfeld.cockpit.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Slow tier that survives restarts. Not bounded by count; lapsed rows are only
 * removed by {@link #deleteExpired(Instant)} or when a read finds them.
 *
 * <p>
 * Implementations report I/O failures as {@link CacheException} with
 * {@link CacheException.Reason#STORAGE}.
 */
public interface DurableCacheStore {

    Optional<CacheEntry> find(String key);

    /**
     * Inserts or overwrites the row for {@code key}.
     */
    void upsert(String key, CacheEntry entry);

    /**
     * @return {@code true} if a row was removed
     */
    boolean delete(String key);

    /**
     * @return number of removed rows
     */
    int clear();

    /**
     * Removes every row whose expiry is at or before {@code now}, the same
     * boundary {@link CacheEntry#isExpired(Instant)} applies on reads.
     *
     * @return number of removed rows
     */
    int deleteExpired(Instant now);
}
