package de.bsommerfeld.cockpit.cache;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One cached payload. Each tier holds its own copy; the byte array is cloned
 * on the way in and on the way out so no two tiers share a buffer.
 */
public record CacheEntry(byte[] serializedValue, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(serializedValue, "serializedValue");
        Objects.requireNonNull(expiresAt, "expiresAt");
        serializedValue = serializedValue.clone();
    }

    @Override
    public byte[] serializedValue() {
        return serializedValue.clone();
    }

    /**
     * An entry is readable only while {@code now < expiresAt}.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CacheEntry))
            return false;
        CacheEntry other = (CacheEntry) o;
        return Arrays.equals(serializedValue, other.serializedValue) && expiresAt.equals(other.expiresAt);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(serializedValue) + expiresAt.hashCode();
    }

    @Override
    public String toString() {
        return "CacheEntry[" + serializedValue.length + " bytes, expiresAt=" + expiresAt + "]";
    }
}
