package de.bsommerfeld.cockpit.cache;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class TieredCacheTest {

    record Sample(String name, int count) {
    }

    private static final Duration TTL = Duration.ofMinutes(5);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqlCacheStore store;
    private TieredCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T10:00:00Z"));
        store = new SqlCacheStore(tempDir.resolve("cache.db"));
        cache = new TieredCache(3, store, clock, Duration.ofSeconds(2));
    }

    // -- Basic Reads and Writes --

    @Test
    void get_shouldReturnValueStoredBySet() {
        cache.set("k", new Sample("a", 1), TTL);

        assertEquals(new Sample("a", 1), cache.get("k", Sample.class));
        assertTrue(cache.exists("k"));
    }

    @Test
    void get_shouldDecodeGenericTypes() {
        cache.set("list", List.of(new Sample("a", 1), new Sample("b", 2)), TTL);

        List<Sample> loaded = cache.get("list", new TypeReference<List<Sample>>() {
        });

        assertEquals(2, loaded.size());
        assertEquals("b", loaded.get(1).name());
    }

    @Test
    void set_shouldWriteThroughToDurableTier() {
        cache.set("k", "value", TTL);

        Optional<CacheEntry> row = store.find("k");
        assertTrue(row.isPresent());
        assertEquals(clock.instant().plus(TTL), row.get().expiresAt());
    }

    @Test
    void set_shouldOverwriteExistingValue() {
        cache.set("k", "first", TTL);
        cache.set("k", "second", TTL);

        assertEquals("second", cache.get("k", String.class));
        assertEquals(1, store.count());
    }

    @Test
    void get_shouldFailWithNotFoundForUnknownKey() {
        CacheException e = assertThrows(CacheException.class, () -> cache.get("missing", String.class));

        assertEquals(CacheException.Reason.NOT_FOUND, e.getReason());
        assertEquals("missing", e.getKey());
        assertFalse(cache.exists("missing"));
    }

    // -- Expiry --

    @Test
    void get_shouldReturnValueUntilTtlElapses() {
        cache.set("k", "v", Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(29));
        assertEquals("v", cache.get("k", String.class));

        clock.advance(Duration.ofSeconds(1));
        CacheException e = assertThrows(CacheException.class, () -> cache.get("k", String.class));
        assertTrue(e.isMiss());
    }

    @Test
    void get_shouldDeleteExpiredDurableRow() {
        cache.set("k", "v", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(11));

        CacheException e = assertThrows(CacheException.class, () -> cache.get("k", String.class));

        assertEquals(CacheException.Reason.EXPIRED, e.getReason());
        assertTrue(store.find("k").isEmpty());
        assertEquals(CacheException.Reason.NOT_FOUND,
                assertThrows(CacheException.class, () -> cache.get("k", String.class)).getReason());
    }

    @Test
    void get_shouldReportExpiredInMemoryOnlyMode() {
        TieredCache memoryOnly = new TieredCache(10, null, clock, Duration.ofSeconds(1));
        memoryOnly.set("k", "v", Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(1));

        CacheException e = assertThrows(CacheException.class, () -> memoryOnly.get("k", String.class));

        assertEquals(CacheException.Reason.EXPIRED, e.getReason());
        assertFalse(memoryOnly.exists("k"));
    }

    @Test
    void set_shouldRejectNegativeTtl() {
        assertThrows(IllegalArgumentException.class, () -> cache.set("k", "v", Duration.ofSeconds(-1)));
    }

    // -- Delete and Clear --

    @Test
    void delete_shouldRemoveFromBothTiers() {
        cache.set("k", "v", TTL);

        cache.delete("k");

        assertFalse(cache.exists("k"));
        assertThrows(CacheException.class, () -> cache.get("k", String.class));
        assertTrue(store.find("k").isEmpty());
    }

    @Test
    void delete_shouldBeIdempotent() {
        assertDoesNotThrow(() -> cache.delete("never-set"));
        assertDoesNotThrow(() -> cache.delete("never-set"));
    }

    @Test
    void clear_shouldRemoveEverything() {
        cache.set("a", 1, TTL);
        cache.set("b", 2, TTL);

        cache.clear();

        assertFalse(cache.exists("a"));
        assertFalse(cache.exists("b"));
        assertEquals(0, store.count());
    }

    // -- Promotion --

    @Test
    void get_shouldPromoteDurableHitIntoMemory() {
        store.upsert("k", new CacheEntry("\"durable\"".getBytes(StandardCharsets.UTF_8), clock.instant().plus(TTL)));
        assertTrue(cache.memoryTier().get("k").isEmpty());

        assertEquals("durable", cache.get("k", String.class));

        assertTrue(cache.memoryTier().get("k").isPresent());
        store.delete("k");
        assertEquals("durable", cache.get("k", String.class));
    }

    @Test
    void memoryTier_shouldEvictLeastRecentlyUsedSilently() {
        TieredCache memoryOnly = new TieredCache(2, null, clock, Duration.ofSeconds(1));
        memoryOnly.set("a", "A", TTL);
        memoryOnly.set("b", "B", TTL);
        memoryOnly.get("a", String.class);

        memoryOnly.set("c", "C", TTL);

        assertTrue(memoryOnly.exists("a"));
        assertFalse(memoryOnly.exists("b"));
        assertTrue(memoryOnly.exists("c"));
    }

    @Test
    void get_shouldFallBackToDurableAfterMemoryEviction() {
        for (int i = 0; i < 5; i++) {
            cache.set("k" + i, i, TTL);
        }

        assertEquals(0, cache.get("k0", Integer.class));
        assertEquals(5, store.count());
    }

    // -- Stale Reads --

    @Test
    void getStale_shouldIgnoreExpiry() {
        cache.set("k", new Sample("old", 7), Duration.ofSeconds(1));
        clock.advance(Duration.ofHours(1));

        assertEquals(Optional.of(new Sample("old", 7)), cache.getStale("k", Sample.class));
        assertEquals(Optional.of(new Sample("old", 7)), cache.getStale("k", Sample.class));
    }

    @Test
    void getStale_shouldReadDurableTierWhenMemoryIsEmpty() {
        store.upsert("k", new CacheEntry("42".getBytes(StandardCharsets.UTF_8), clock.instant().minusSeconds(60)));

        assertEquals(Optional.of(42), cache.getStale("k", Integer.class));
    }

    @Test
    void getStale_shouldReturnEmptyForMissingOrUndecodableEntries() {
        cache.set("text", "not a sample", TTL);

        assertTrue(cache.getStale("missing", String.class).isEmpty());
        assertTrue(cache.getStale("text", Sample.class).isEmpty());
    }

    // -- Errors --

    @Test
    void get_shouldFailWithSerializationForWrongType() {
        cache.set("k", "plain text", TTL);

        CacheException e = assertThrows(CacheException.class, () -> cache.get("k", Sample.class));

        assertEquals(CacheException.Reason.SERIALIZATION, e.getReason());
        assertFalse(e.isMiss());
    }

    @Test
    void get_shouldFailWithLockWhenWriterHoldsTheCache() throws Exception {
        CountDownLatch writing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        DurableCacheStore slowStore = new DurableCacheStore() {
            @Override
            public Optional<CacheEntry> find(String key) {
                return Optional.empty();
            }

            @Override
            public void upsert(String key, CacheEntry entry) {
                writing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }

            @Override
            public boolean delete(String key) {
                return false;
            }

            @Override
            public int clear() {
                return 0;
            }

            @Override
            public int deleteExpired(Instant now) {
                return 0;
            }
        };
        TieredCache blocked = new TieredCache(10, slowStore, clock, Duration.ofMillis(50));
        Thread writer = new Thread(() -> blocked.set("k", "v", TTL));
        writer.start();
        try {
            assertTrue(writing.await(5, TimeUnit.SECONDS));

            CacheException e = assertThrows(CacheException.class, () -> blocked.get("k", String.class));
            assertEquals(CacheException.Reason.LOCK, e.getReason());
        } finally {
            release.countDown();
            writer.join(5000);
        }

        assertEquals("v", blocked.get("k", String.class));
    }

    // -- Cleanup --

    @Test
    void cleanupExpired_shouldSweepOnlyLapsedRows() {
        cache.set("short", "s", Duration.ofSeconds(10));
        cache.set("long", "l", Duration.ofHours(1));
        clock.advance(Duration.ofMinutes(1));

        assertEquals(1, cache.cleanupExpired());
        assertTrue(store.find("short").isEmpty());
        assertTrue(store.find("long").isPresent());
    }

    @Test
    void cleanupExpired_shouldSweepEntryExpiringExactlyNow() {
        cache.set("edge", "e", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(10));

        assertEquals(1, cache.cleanupExpired());
        assertTrue(store.find("edge").isEmpty());
    }

    @Test
    void cleanupExpired_shouldReturnZeroWithoutDurableTier() {
        TieredCache memoryOnly = new TieredCache();

        assertFalse(memoryOnly.hasDurableTier());
        assertEquals(0, memoryOnly.cleanupExpired());
    }

    @Test
    void durableTier_shouldSurviveNewCacheInstance() {
        cache.set("k", "persisted", TTL);

        TieredCache reopened = new TieredCache(3, new SqlCacheStore(tempDir.resolve("cache.db")), clock,
                Duration.ofSeconds(1));

        assertEquals("persisted", reopened.get("k", String.class));
    }
}
