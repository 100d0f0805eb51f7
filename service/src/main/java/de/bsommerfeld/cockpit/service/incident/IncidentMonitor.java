package de.bsommerfeld.cockpit.service.incident;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.cache.CacheException;
import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.config.CacheConfig;
import de.bsommerfeld.cockpit.core.config.IncidentConfig;
import de.bsommerfeld.cockpit.core.domain.Incident;
import de.bsommerfeld.cockpit.core.domain.Severity;
import de.bsommerfeld.cockpit.core.source.IncidentSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Watches the monitoring platform's incident list. Same cache-aside shape as
 * the PR aggregator, keyed on {@value #SUMMARY_KEY}.
 *
 * <p>
 * Incidents from services outside the configured allow-list are dropped
 * before anything else sees them. Lists returned by this class are ordered
 * most severe first, then longest running first.
 */
@Singleton
public class IncidentMonitor {

    private static final Logger LOG = LoggerFactory.getLogger(IncidentMonitor.class);

    public static final String SUMMARY_KEY = "incident_summary";

    static final Comparator<Incident> SEVERITY_ORDER = Comparator
            .comparing(Incident::severity, Comparator.reverseOrder())
            .thenComparing(Incident::startedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final IncidentSource source;
    private final TieredCache cache;
    private final IncidentConfig config;
    private final Duration summaryTtl;
    private final Clock clock;

    // last summary handed out; survives eviction of the cache entry
    private final AtomicReference<IncidentSummary> lastSummary = new AtomicReference<>();

    @Inject
    public IncidentMonitor(IncidentSource source, TieredCache cache, IncidentConfig config, CacheConfig cacheConfig,
            Clock clock) {
        this(source, cache, config, cacheConfig.getIncidentListTtl(), clock);
    }

    /**
     * @param cache may be {@code null}
     */
    public IncidentMonitor(IncidentSource source, TieredCache cache, IncidentConfig config, Duration summaryTtl,
            Clock clock) {
        this.source = source;
        this.cache = cache;
        this.config = config;
        this.summaryTtl = summaryTtl;
        this.clock = clock;
    }

    public IncidentSummary getSummary() throws SourceException {
        if (cache != null) {
            try {
                IncidentSummary cached = cache.get(SUMMARY_KEY, IncidentSummary.class);
                lastSummary.set(cached);
                return cached;
            } catch (CacheException e) {
                if (!e.isMiss())
                    LOG.warn("Incident summary cache read failed ({}), fetching live", e.getReason());
            }
        }

        IncidentSummary summary = computeSummary(fetchAll());
        lastSummary.set(summary);

        if (cache != null) {
            try {
                cache.set(SUMMARY_KEY, summary, summaryTtl);
            } catch (CacheException e) {
                LOG.warn("Could not cache incident summary: {}", e.getMessage());
            }
        }
        return summary;
    }

    public Optional<IncidentSummary> getLastKnownSummary() {
        if (cache != null) {
            Optional<IncidentSummary> stale = cache.getStale(SUMMARY_KEY, IncidentSummary.class);
            if (stale.isPresent())
                return stale;
        }
        return Optional.ofNullable(lastSummary.get());
    }

    public List<Incident> fetchAll() throws SourceException {
        List<String> services = config.getServices();
        return source.listActiveIncidents().stream()
                .filter(i -> services == null || services.isEmpty() || services.contains(i.service()))
                .collect(Collectors.toList());
    }

    public List<Incident> getIncidents(IncidentFilter filter) throws SourceException {
        return fetchAll().stream()
                .filter(filter::matches)
                .sorted(SEVERITY_ORDER)
                .collect(Collectors.toList());
    }

    /**
     * Firing incidents at or above {@code alert-on-severity}.
     */
    public List<Incident> getAlertableIncidents() throws SourceException {
        return getIncidents(IncidentFilter.active().withMinSeverity(config.getAlertOnSeverity()));
    }

    public boolean hasCriticalIncidents() throws SourceException {
        return !getIncidents(IncidentFilter.active().withMinSeverity(Severity.CRITICAL)).isEmpty();
    }

    IncidentSummary computeSummary(List<Incident> incidents) {
        Instant now = clock.instant();
        List<Incident> active = incidents.stream()
                .filter(Incident::isActive)
                .sorted(SEVERITY_ORDER)
                .collect(Collectors.toList());

        int critical = 0;
        int high = 0;
        int medium = 0;
        int low = 0;
        Map<String, Integer> byService = new LinkedHashMap<>();
        Long longestMinutes = null;

        for (Incident incident : active) {
            byService.merge(incident.service(), 1, Integer::sum);
            switch (incident.severity()) {
                case CRITICAL:
                    critical++;
                    break;
                case HIGH:
                    high++;
                    break;
                case MEDIUM:
                    medium++;
                    break;
                default:
                    low++;
                    break;
            }
            if (incident.startedAt() != null) {
                long minutes = Duration.between(incident.startedAt(), now).toMinutes();
                if (longestMinutes == null || minutes > longestMinutes)
                    longestMinutes = minutes;
            }
        }

        Severity mostSevere = active.isEmpty() ? null : active.get(0).severity();
        List<String> ids = active.stream().map(Incident::id).collect(Collectors.toList());

        return new IncidentSummary(active.size(), critical, high, medium, low, byService, mostSevere,
                longestMinutes, ids, AlertLevel.compute(active.size(), 0, 0));
    }
}
