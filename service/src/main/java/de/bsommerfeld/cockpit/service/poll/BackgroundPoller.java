package de.bsommerfeld.cockpit.service.poll;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.alert.AlertStatus;
import de.bsommerfeld.cockpit.core.alert.AlertTransition;
import de.bsommerfeld.cockpit.core.config.PollerConfig;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.AlertLevelChanged;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.ErrorOccurred;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.IncidentsUpdated;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.PollTick;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.PullRequestsUpdated;
import de.bsommerfeld.cockpit.service.incident.IncidentMonitor;
import de.bsommerfeld.cockpit.service.incident.IncidentSummary;
import de.bsommerfeld.cockpit.service.pr.PrAggregator;
import de.bsommerfeld.cockpit.service.pr.PrSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Drives the aggregators on a schedule and turns their summaries into events
 * and alert level transitions.
 *
 * <h3>Per tick</h3>
 * <ol>
 * <li>Ask the domain's aggregator for a summary (the aggregator consults the
 * cache itself).</li>
 * <li>Record the timestamp, bump the poll counter, and reset or bump the
 * consecutive failure counter.</li>
 * <li>Publish the domain's data event and a {@link PollTick}.</li>
 * <li>Recompute the alert level and publish {@link AlertLevelChanged} if it
 * moved.</li>
 * </ol>
 * A failed tick publishes {@link ErrorOccurred} and, when a last known summary
 * is cached, a data event flagged {@code fromCache}. It is not retried; the
 * next scheduled tick is the retry.
 *
 * <h3>Threading model</h3>
 * Each domain owns a single-thread scheduler and reschedules itself after
 * every tick, so ticks of one domain never overlap while different domains run
 * in parallel. Manual polls ({@link #refreshAll()}) take the same per-domain
 * lock and wait for an in-flight tick to finish. After consecutive failures
 * the next delay doubles per failure, capped at {@code max-backoff-seconds}.
 * {@link #stop()} cancels pending ticks; a running tick completes but
 * schedules nothing further.
 */
@Singleton
public class BackgroundPoller {

    private static final Logger LOG = LoggerFactory.getLogger(BackgroundPoller.class);

    private final PrAggregator prAggregator;
    private final IncidentMonitor incidentMonitor;
    private final ApplicationEventBus eventBus;
    private final Clock clock;
    private final Duration initialDelay;
    private final Duration maxBackoff;

    private final Map<PollDomain, DomainTracker> trackers = new EnumMap<>(PollDomain.class);

    private final Object alertLock = new Object();
    private AlertStatus alertStatus = AlertStatus.EMPTY;
    private AlertLevel alertLevel = AlertLevel.NEUTRAL;
    private AlertTransition lastTransition;

    // guarded by the incident domain's tick lock
    private Set<String> knownIncidentIds = new HashSet<>();

    private volatile boolean running;

    @Inject
    public BackgroundPoller(PrAggregator prAggregator, IncidentMonitor incidentMonitor, ApplicationEventBus eventBus,
            PollerConfig config, Clock clock) {
        this.prAggregator = prAggregator;
        this.incidentMonitor = incidentMonitor;
        this.eventBus = eventBus;
        this.clock = clock;
        this.initialDelay = config.getInitialDelay();
        this.maxBackoff = config.getMaxBackoff();
        trackers.put(PollDomain.PULL_REQUESTS, new DomainTracker(PollDomain.PULL_REQUESTS,
                config.isPrPollingEnabled(), config.getPrPollInterval()));
        trackers.put(PollDomain.INCIDENTS, new DomainTracker(PollDomain.INCIDENTS,
                config.isIncidentPollingEnabled(), config.getIncidentPollInterval()));
    }

    // =====================================================================
    // Lifecycle
    // =====================================================================

    public synchronized void start() {
        if (running) {
            LOG.warn("Background poller already running");
            return;
        }
        running = true;
        for (DomainTracker tracker : trackers.values()) {
            if (!tracker.enabled) {
                LOG.info("Polling for {} disabled", tracker.domain.id());
                continue;
            }
            tracker.executor = Executors.newSingleThreadScheduledExecutor(
                    new ThreadFactoryBuilder().setNameFormat("poller-" + tracker.domain.id()).setDaemon(true).build());
            scheduleNext(tracker, initialDelay, tracker.executor);
            LOG.info("Polling {} every {}", tracker.domain.id(), tracker.interval);
        }
    }

    /**
     * Stops scheduling. A tick that is already running finishes normally.
     */
    public synchronized void stop() {
        if (!running)
            return;
        running = false;
        for (DomainTracker tracker : trackers.values()) {
            if (tracker.next != null)
                tracker.next.cancel(false);
            if (tracker.executor != null)
                tracker.executor.shutdown();
            tracker.next = null;
            tracker.executor = null;
        }
        LOG.info("Background poller stopped");
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Schedules the next tick of a chain. Each chain is bound to the executor
     * it was started on; a tick that outlives a stop/start cycle finds a
     * different executor on its tracker and ends its chain.
     */
    private synchronized void scheduleNext(DomainTracker tracker, Duration delay, ScheduledExecutorService chain) {
        if (!running || tracker.executor != chain)
            return;
        tracker.next = chain.schedule(() -> runScheduledTick(tracker, chain), delay.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    private void runScheduledTick(DomainTracker tracker, ScheduledExecutorService chain) {
        if (!running)
            return;
        try {
            poll(tracker.domain);
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure in {} tick", tracker.domain.id(), e);
        } finally {
            scheduleNext(tracker, nextDelay(tracker.interval, tracker.consecutiveFailures(), maxBackoff), chain);
        }
    }

    /**
     * Delay before the next tick: the plain interval after a success,
     * otherwise the interval doubled per consecutive failure, never more than
     * {@code maxBackoff} (or the interval, if that is larger). A zero
     * {@code maxBackoff} disables backoff.
     */
    static Duration nextDelay(Duration interval, int consecutiveFailures, Duration maxBackoff) {
        if (consecutiveFailures <= 0 || maxBackoff.isZero() || maxBackoff.isNegative())
            return interval;
        Duration cap = maxBackoff.compareTo(interval) > 0 ? maxBackoff : interval;
        Duration delay = interval;
        for (int i = 0; i < consecutiveFailures && delay.compareTo(cap) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(cap) > 0 ? cap : delay;
    }

    // =====================================================================
    // Polling
    // =====================================================================

    /**
     * Polls every enabled domain now, bypassing the schedule but not the
     * cache TTLs.
     */
    public void refreshAll() {
        LOG.info("Manual refresh triggered");
        for (DomainTracker tracker : trackers.values()) {
            if (tracker.enabled)
                poll(tracker.domain);
        }
    }

    public PollResult<?> poll(PollDomain domain) {
        switch (domain) {
            case PULL_REQUESTS:
                return pollPullRequests();
            case INCIDENTS:
                return pollIncidents();
            default:
                throw new IllegalArgumentException("Unknown domain: " + domain);
        }
    }

    public PollResult<PrSummary> pollPullRequests() {
        DomainTracker tracker = trackers.get(PollDomain.PULL_REQUESTS);
        tracker.tickLock.lock();
        try {
            tracker.phase = DomainPhase.POLLING;
            LOG.debug("Polling pull requests");

            PollResult<PrSummary> result;
            try {
                result = PollResult.success(PollDomain.PULL_REQUESTS, prAggregator.getSummary(), clock.instant());
            } catch (Exception e) {
                result = PollResult.failure(PollDomain.PULL_REQUESTS,
                        prAggregator.getLastKnownSummary().orElse(null), clock.instant(), describe(e));
            }
            tracker.record(result);
            if (!result.success())
                reportFailure(tracker, result.errorMessage());

            PrSummary data = result.data();
            if (data != null) {
                eventBus.publish(new PullRequestsUpdated(data.totalOpen(), data.staleCount(), data.pendingReview(),
                        !result.success()));
            }
            eventBus.publish(new PollTick(PollDomain.PULL_REQUESTS.id(), result.timestamp(), result.success()));

            if (data != null)
                updateAlert(status -> status.withPullRequests(data.pendingReview(), data.staleCount()));
            return result;
        } finally {
            tracker.phase = DomainPhase.IDLE;
            tracker.tickLock.unlock();
        }
    }

    public PollResult<IncidentSummary> pollIncidents() {
        DomainTracker tracker = trackers.get(PollDomain.INCIDENTS);
        tracker.tickLock.lock();
        try {
            tracker.phase = DomainPhase.POLLING;
            LOG.debug("Polling incidents");

            PollResult<IncidentSummary> result;
            List<String> newIds = List.of();
            try {
                IncidentSummary summary = incidentMonitor.getSummary();
                result = PollResult.success(PollDomain.INCIDENTS, summary, clock.instant());
                newIds = summary.activeIncidentIds().stream()
                        .filter(id -> !knownIncidentIds.contains(id))
                        .collect(Collectors.toList());
                knownIncidentIds = new HashSet<>(summary.activeIncidentIds());
            } catch (Exception e) {
                result = PollResult.failure(PollDomain.INCIDENTS,
                        incidentMonitor.getLastKnownSummary().orElse(null), clock.instant(), describe(e));
            }
            tracker.record(result);
            if (!result.success())
                reportFailure(tracker, result.errorMessage());
            if (!newIds.isEmpty())
                LOG.info("New incidents: {}", newIds);

            IncidentSummary data = result.data();
            if (data != null)
                eventBus.publish(new IncidentsUpdated(data.totalActive(), data.criticalCount(), newIds));
            eventBus.publish(new PollTick(PollDomain.INCIDENTS.id(), result.timestamp(), result.success()));

            if (data != null)
                updateAlert(status -> status.withIncidents(data.totalActive()));
            return result;
        } finally {
            tracker.phase = DomainPhase.IDLE;
            tracker.tickLock.unlock();
        }
    }

    private void reportFailure(DomainTracker tracker, String message) {
        LOG.warn("Polling {} failed ({} in a row): {}", tracker.domain.id(), tracker.consecutiveFailures(),
                message);
        eventBus.publish(new ErrorOccurred(tracker.domain.id(), message, true));
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    // =====================================================================
    // Alert level
    // =====================================================================

    private void updateAlert(UnaryOperator<AlertStatus> change) {
        AlertTransition transition = null;
        synchronized (alertLock) {
            alertStatus = change.apply(alertStatus);
            AlertLevel computed = alertStatus.level();
            if (computed != alertLevel) {
                transition = AlertTransition.between(alertLevel, computed, alertStatus.describe(), clock.instant());
                alertLevel = computed;
                lastTransition = transition;
            }
        }
        if (transition != null) {
            LOG.info("Alert level {} -> {} ({})", transition.from(), transition.to(), transition.reason());
            eventBus.publish(new AlertLevelChanged(transition.from(), transition.to(), transition.reason()));
        }
    }

    public AlertLevel getAlertLevel() {
        synchronized (alertLock) {
            return alertLevel;
        }
    }

    public AlertStatus getAlertStatus() {
        synchronized (alertLock) {
            return alertStatus;
        }
    }

    public Optional<AlertTransition> getLastTransition() {
        synchronized (alertLock) {
            return Optional.ofNullable(lastTransition);
        }
    }

    public PollerState getState() {
        synchronized (alertLock) {
            return new PollerState(running,
                    trackers.get(PollDomain.PULL_REQUESTS).snapshot(),
                    trackers.get(PollDomain.INCIDENTS).snapshot(),
                    alertLevel, alertStatus);
        }
    }

    private static final class DomainTracker {

        final PollDomain domain;
        final boolean enabled;
        final Duration interval;
        final ReentrantLock tickLock = new ReentrantLock();

        volatile DomainPhase phase = DomainPhase.IDLE;

        // guarded by the poller's monitor
        ScheduledExecutorService executor;
        ScheduledFuture<?> next;

        private Instant lastPoll;
        private long pollCount;
        private int consecutiveFailures;
        private String lastError;

        DomainTracker(PollDomain domain, boolean enabled, Duration interval) {
            this.domain = domain;
            this.enabled = enabled;
            this.interval = interval;
        }

        synchronized void record(PollResult<?> result) {
            lastPoll = result.timestamp();
            pollCount++;
            if (result.success()) {
                consecutiveFailures = 0;
                lastError = null;
            } else {
                consecutiveFailures++;
                lastError = result.errorMessage();
            }
        }

        synchronized int consecutiveFailures() {
            return consecutiveFailures;
        }

        synchronized DomainState snapshot() {
            return new DomainState(domain, phase, enabled, lastPoll, pollCount, consecutiveFailures, lastError);
        }
    }
}
