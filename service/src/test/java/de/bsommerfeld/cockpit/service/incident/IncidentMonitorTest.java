package de.bsommerfeld.cockpit.service.incident;

import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.config.IncidentConfig;
import de.bsommerfeld.cockpit.core.domain.Incident;
import de.bsommerfeld.cockpit.core.domain.IncidentStatus;
import de.bsommerfeld.cockpit.core.domain.Severity;
import de.bsommerfeld.cockpit.core.source.IncidentSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import de.bsommerfeld.cockpit.service.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IncidentMonitorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final List<Incident> incidents = new ArrayList<>();
    private int fetches;
    private IncidentConfig config;
    private IncidentMonitor monitor;

    private final IncidentSource source = () -> {
        fetches++;
        return List.copyOf(incidents);
    };

    @BeforeEach
    void setUp() {
        config = new IncidentConfig();
        monitor = new IncidentMonitor(source, null, config, Duration.ofSeconds(30), clock);
    }

    // -- Summary --

    @Test
    void getSummary_shouldCountFiringIncidentsBySeverity() throws Exception {
        incidents.add(incident("i-1", "api", Severity.HIGH, IncidentStatus.FIRING, 10));
        incidents.add(incident("i-2", "api", Severity.CRITICAL, IncidentStatus.FIRING, 5));
        incidents.add(incident("i-3", "db", Severity.LOW, IncidentStatus.FIRING, 90));
        incidents.add(incident("i-4", "db", Severity.CRITICAL, IncidentStatus.RESOLVED, 300));

        IncidentSummary summary = monitor.getSummary();

        assertEquals(3, summary.totalActive());
        assertEquals(1, summary.criticalCount());
        assertEquals(1, summary.highCount());
        assertEquals(0, summary.mediumCount());
        assertEquals(1, summary.lowCount());
        assertEquals(Map.of("api", 2, "db", 1), summary.countsByService());
        assertEquals(Severity.CRITICAL, summary.mostSevere());
        assertEquals(90L, summary.longestDurationMinutes());
        assertEquals(List.of("i-2", "i-1", "i-3"), summary.activeIncidentIds());
        assertEquals(AlertLevel.RED, summary.alertLevel());
    }

    @Test
    void getSummary_shouldBeGreenWithoutFiringIncidents() throws Exception {
        incidents.add(incident("i-1", "api", Severity.CRITICAL, IncidentStatus.RESOLVED, 10));

        IncidentSummary summary = monitor.getSummary();

        assertEquals(0, summary.totalActive());
        assertNull(summary.mostSevere());
        assertNull(summary.longestDurationMinutes());
        assertEquals(AlertLevel.GREEN, summary.alertLevel());
    }

    @Test
    void getSummary_shouldIgnoreServicesOutsideAllowList() throws Exception {
        config.setServices(List.of("api"));
        incidents.add(incident("i-1", "api", Severity.LOW, IncidentStatus.FIRING, 1));
        incidents.add(incident("i-2", "db", Severity.CRITICAL, IncidentStatus.FIRING, 1));

        IncidentSummary summary = monitor.getSummary();

        assertEquals(1, summary.totalActive());
        assertEquals(Severity.LOW, summary.mostSevere());
    }

    @Test
    void getSummary_shouldUseCacheUntilTtlLapses() throws Exception {
        TieredCache cache = new TieredCache(10, null, clock, Duration.ofSeconds(1));
        var cached = new IncidentMonitor(source, cache, config, Duration.ofSeconds(30), clock);
        incidents.add(incident("i-1", "api", Severity.HIGH, IncidentStatus.FIRING, 1));

        cached.getSummary();
        incidents.clear();
        IncidentSummary second = cached.getSummary();

        assertEquals(1, fetches);
        assertEquals(1, second.totalActive());
        assertEquals(second, cached.getLastKnownSummary().orElseThrow());
    }

    @Test
    void getLastKnownSummary_shouldSurviveExpiredEntryAfterFailedRefresh() throws Exception {
        MutableClock moving = new MutableClock(NOW);
        TieredCache cache = new TieredCache(10, null, moving, Duration.ofHours(1));
        boolean[] down = {false};
        IncidentSource flaky = () -> {
            if (down[0])
                throw new SourceException(SourceException.Kind.NETWORK, "timeout");
            return List.of(incident("i-1", "api", Severity.CRITICAL, IncidentStatus.FIRING, 1));
        };
        var refreshing = new IncidentMonitor(flaky, cache, config, Duration.ofSeconds(30), moving);

        IncidentSummary summary = refreshing.getSummary();
        down[0] = true;
        moving.advance(Duration.ofSeconds(31));

        assertThrows(SourceException.class, refreshing::getSummary);
        assertFalse(cache.exists(IncidentMonitor.SUMMARY_KEY));
        assertEquals(summary, refreshing.getLastKnownSummary().orElseThrow());
    }

    // -- Filtering --

    @Test
    void getIncidents_shouldApplyFilterAndOrderBySeverity() throws Exception {
        incidents.add(incident("low", "api", Severity.LOW, IncidentStatus.FIRING, 1));
        incidents.add(incident("high-new", "api", Severity.HIGH, IncidentStatus.FIRING, 5));
        incidents.add(incident("high-old", "db", Severity.HIGH, IncidentStatus.FIRING, 50));
        incidents.add(incident("crit-resolved", "db", Severity.CRITICAL, IncidentStatus.RESOLVED, 60));

        assertEquals(List.of("high-old", "high-new"),
                ids(monitor.getIncidents(IncidentFilter.active().withMinSeverity(Severity.HIGH))));
        assertEquals(List.of("crit-resolved", "high-old", "high-new", "low"),
                ids(monitor.getIncidents(IncidentFilter.active().includingResolved())));
        assertEquals(List.of("high-old"),
                ids(monitor.getIncidents(IncidentFilter.active().withServices(List.of("db")))));
    }

    @Test
    void getAlertableIncidents_shouldUseConfiguredSeverity() throws Exception {
        incidents.add(incident("m", "api", Severity.MEDIUM, IncidentStatus.FIRING, 1));
        incidents.add(incident("h", "api", Severity.HIGH, IncidentStatus.FIRING, 1));

        assertEquals(List.of("h"), ids(monitor.getAlertableIncidents()));

        config.setAlertOnSeverity(Severity.MEDIUM);
        assertEquals(List.of("h", "m"), ids(monitor.getAlertableIncidents()));
    }

    @Test
    void hasCriticalIncidents_shouldOnlyCountFiringCriticals() throws Exception {
        incidents.add(incident("c", "api", Severity.CRITICAL, IncidentStatus.RESOLVED, 1));
        assertFalse(monitor.hasCriticalIncidents());

        incidents.add(incident("c2", "api", Severity.CRITICAL, IncidentStatus.FIRING, 1));
        assertTrue(monitor.hasCriticalIncidents());
    }

    @Test
    void filter_shouldMatchEverythingActiveByDefault() {
        IncidentFilter filter = IncidentFilter.active();

        assertTrue(filter.matches(incident("a", "x", Severity.LOW, IncidentStatus.FIRING, 1)));
        assertFalse(filter.matches(incident("b", "x", Severity.LOW, IncidentStatus.RESOLVED, 1)));
    }

    @Test
    void getSummary_shouldPropagateSourceFailure() {
        var failing = new IncidentMonitor(() -> {
            throw new SourceException(SourceException.Kind.AUTH, "token expired");
        }, null, config, Duration.ofSeconds(30), clock);

        SourceException e = assertThrows(SourceException.class, failing::getSummary);
        assertEquals(SourceException.Kind.AUTH, e.getKind());
    }

    private static List<String> ids(List<Incident> incidents) {
        return incidents.stream().map(Incident::id).collect(Collectors.toList());
    }

    private static Incident incident(String id, String service, Severity severity, IncidentStatus status,
            long minutesAgo) {
        Instant started = NOW.minus(Duration.ofMinutes(minutesAgo));
        return new Incident(id, service, severity, status, started,
                status == IncidentStatus.RESOLVED ? NOW : null, "Incident " + id, null);
    }
}
