package de.bsommerfeld.cockpit.cache;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.CacheInvalidated;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically sweeps lapsed rows out of the durable tier, independent of
 * reads. A sweep that removed anything is announced as
 * {@link CacheInvalidated} with cache type {@code "durable"}.
 */
public class CacheJanitor {

    private static final Logger LOG = LoggerFactory.getLogger(CacheJanitor.class);

    static final String CACHE_TYPE = "durable";

    private final TieredCache cache;
    private final ApplicationEventBus eventBus;
    private final Duration interval;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> task;

    public CacheJanitor(TieredCache cache, ApplicationEventBus eventBus, Duration interval) {
        if (interval.isZero() || interval.isNegative())
            throw new IllegalArgumentException("interval must be positive: " + interval);
        this.cache = cache;
        this.eventBus = eventBus;
        this.interval = interval;
    }

    public synchronized void start() {
        if (task != null)
            return;
        if (!cache.hasDurableTier()) {
            LOG.info("Cache janitor not started, no durable tier configured");
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("cache-janitor").setDaemon(true).build());
        long millis = interval.toMillis();
        task = executor.scheduleWithFixedDelay(this::scheduledSweep, millis, millis, TimeUnit.MILLISECONDS);
        LOG.info("Cache janitor started, sweeping every {}", interval);
    }

    public synchronized void stop() {
        if (task == null)
            return;
        task.cancel(false);
        executor.shutdown();
        task = null;
        executor = null;
        LOG.info("Cache janitor stopped");
    }

    public synchronized boolean isRunning() {
        return task != null;
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return number of removed rows
     */
    public int sweep() {
        int removed = cache.cleanupExpired();
        if (removed > 0) {
            LOG.info("Removed {} expired cache rows", removed);
            eventBus.publish(new CacheInvalidated(CACHE_TYPE, List.of(), removed));
        }
        return removed;
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (CacheException e) {
            // next run retries; an exception here would cancel the schedule
            LOG.warn("Cache sweep failed ({}): {}", e.getReason(), e.getMessage());
        }
    }
}
