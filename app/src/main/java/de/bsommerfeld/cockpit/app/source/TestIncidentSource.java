package de.bsommerfeld.cockpit.app.source;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.core.domain.Incident;
import de.bsommerfeld.cockpit.core.domain.IncidentStatus;
import de.bsommerfeld.cockpit.core.source.IncidentSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Offline {@link IncidentSource} for TEST mode.
 *
 * <h3>Simulated cadence</h3>
 * Every {@value #FIRE_INTERVAL}th call fires a new incident and every
 * {@value #RESOLVE_INTERVAL}th call resolves the oldest firing one, so the
 * alert level moves between green and red while the cockpit runs. Resolved
 * incidents stay in the list, as they do on real monitoring platforms for a
 * while after recovery.
 */
@Singleton
public class TestIncidentSource implements IncidentSource {

    private static final Logger LOG = LoggerFactory.getLogger(TestIncidentSource.class);

    static final int FIRE_INTERVAL = 4;
    static final int RESOLVE_INTERVAL = 6;
    private static final int MAX_RETAINED = 20;

    private final Clock clock;
    private final List<Incident> incidents = new ArrayList<>();
    private int callCount = 0;

    @Inject
    public TestIncidentSource(Clock clock) {
        this.clock = clock;
        LOG.warn("TEST MODE: incidents are simulated");
    }

    @Override
    public synchronized List<Incident> listActiveIncidents() {
        callCount++;
        if (callCount % FIRE_INTERVAL == 0) {
            Incident fired = TestDataGenerator.generateIncident(clock.instant());
            incidents.add(fired);
            LOG.debug("[TEST] Fired {} ({}) on {}", fired.id(), fired.severity(), fired.service());
        }
        if (callCount % RESOLVE_INTERVAL == 0)
            resolveOldest();
        while (incidents.size() > MAX_RETAINED) {
            incidents.remove(0);
        }
        return List.copyOf(incidents);
    }

    private void resolveOldest() {
        for (int i = 0; i < incidents.size(); i++) {
            Incident incident = incidents.get(i);
            if (incident.isActive()) {
                incidents.set(i, new Incident(incident.id(), incident.service(), incident.severity(),
                        IncidentStatus.RESOLVED, incident.startedAt(), clock.instant(), incident.description(),
                        incident.runbookUrl()));
                LOG.debug("[TEST] Resolved {}", incident.id());
                return;
            }
        }
    }
}
