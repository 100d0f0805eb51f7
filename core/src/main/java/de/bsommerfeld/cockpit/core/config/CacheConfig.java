package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Tiered cache sizing and per-domain TTLs.
 */
public class CacheConfig {

    /** Entries kept in the in-memory tier before least-recently-used eviction. */
    @JsonProperty("memory-capacity")
    private int memoryCapacity = 100;

    /** Whether the SQLite tier is used at all. */
    @JsonProperty("persistent")
    private boolean persistent = true;

    /** File name of the SQLite tier, relative to the app data directory. */
    @JsonProperty("database-file")
    private String databaseFile = "cache.db";

    @JsonProperty("ticket-search-ttl-seconds")
    private long ticketSearchTtlSeconds = 300;

    @JsonProperty("pr-list-ttl-seconds")
    private long prListTtlSeconds = 120;

    @JsonProperty("incident-list-ttl-seconds")
    private long incidentListTtlSeconds = 30;

    @JsonProperty("cleanup-interval-minutes")
    private long cleanupIntervalMinutes = 10;

    @JsonProperty("lock-timeout-millis")
    private long lockTimeoutMillis = 5000;

    public int getMemoryCapacity() {
        return memoryCapacity;
    }

    public void setMemoryCapacity(int memoryCapacity) {
        this.memoryCapacity = memoryCapacity;
    }

    public boolean isPersistent() {
        return persistent;
    }

    public void setPersistent(boolean persistent) {
        this.persistent = persistent;
    }

    public String getDatabaseFile() {
        return databaseFile;
    }

    @JsonIgnore
    public Duration getTicketSearchTtl() {
        return Duration.ofSeconds(ticketSearchTtlSeconds);
    }

    @JsonIgnore
    public Duration getPrListTtl() {
        return Duration.ofSeconds(prListTtlSeconds);
    }

    @JsonIgnore
    public Duration getIncidentListTtl() {
        return Duration.ofSeconds(incidentListTtlSeconds);
    }

    @JsonIgnore
    public Duration getCleanupInterval() {
        return Duration.ofMinutes(cleanupIntervalMinutes);
    }

    @JsonIgnore
    public Duration getLockTimeout() {
        return Duration.ofMillis(lockTimeoutMillis);
    }

    public void setLockTimeoutMillis(long lockTimeoutMillis) {
        this.lockTimeoutMillis = lockTimeoutMillis;
    }
}
