package de.bsommerfeld.cockpit.cache;

/**
 * Raised by {@link TieredCache} operations. {@link Reason#NOT_FOUND} and
 * {@link Reason#EXPIRED} are ordinary misses that callers answer by fetching
 * fresh data; the other reasons fail only the operation that raised them.
 */
public class CacheException extends RuntimeException {

    public enum Reason {
        NOT_FOUND,
        EXPIRED,
        SERIALIZATION,
        STORAGE,
        LOCK
    }

    private final Reason reason;
    private final String key;

    public CacheException(Reason reason, String key, String message) {
        this(reason, key, message, null);
    }

    public CacheException(Reason reason, String key, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.key = key;
    }

    static CacheException notFound(String key) {
        return new CacheException(Reason.NOT_FOUND, key, "No cache entry for '" + key + "'");
    }

    static CacheException expired(String key) {
        return new CacheException(Reason.EXPIRED, key, "Cache entry for '" + key + "' has expired");
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the affected key, or {@code null} for whole-cache operations
     */
    public String getKey() {
        return key;
    }

    /**
     * {@code true} for the two reasons that mean "nothing usable cached".
     */
    public boolean isMiss() {
        return reason == Reason.NOT_FOUND || reason == Reason.EXPIRED;
    }
}
