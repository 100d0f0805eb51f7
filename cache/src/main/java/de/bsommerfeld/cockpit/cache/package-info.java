/**
 * Two-level cache for aggregated views.
 *
 * <pre>
 *   [Aggregators / Poller]
 *            │
 *            ▼
 *       TieredCache        ← promotion, fallback and locking policy
 *        ┌───┴────┐
 *        │        │
 *  MemoryCacheTier  DurableCacheStore
 *   (Guava, LRU)     (SqlCacheStore, SQLite)
 * </pre>
 *
 * <h2>Table</h2>
 *
 * <pre>
 * cache(key TEXT PRIMARY KEY, value BLOB, expires_at INTEGER)
 * </pre>
 *
 * {@code value} holds the JSON payload written by {@link
 * de.bsommerfeld.cockpit.cache.CacheSerializer}; {@code expires_at} is epoch
 * milliseconds and indexed for the sweep done by {@link
 * de.bsommerfeld.cockpit.cache.CacheJanitor}.
 *
 * <h2>SQL files</h2>
 * One per {@link de.bsommerfeld.cockpit.cache.CacheStatement} constant:
 * <ul>
 * <li>{@code select-cache-entry.sql}</li>
 * <li>{@code upsert-cache-entry.sql} (INSERT OR REPLACE)</li>
 * <li>{@code delete-cache-entry.sql}</li>
 * <li>{@code delete-all-cache-entries.sql}</li>
 * <li>{@code delete-expired-cache-entries.sql}</li>
 * <li>{@code count-cache-entries.sql}</li>
 * </ul>
 */
package de.bsommerfeld.cockpit.cache;
