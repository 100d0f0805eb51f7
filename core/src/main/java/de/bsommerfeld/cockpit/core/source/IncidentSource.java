package de.bsommerfeld.cockpit.core.source;

import de.bsommerfeld.cockpit.core.domain.Incident;

import java.util.List;

/**
 * Monitoring-platform capability consumed by the incident monitor. The list
 * may contain recently resolved incidents; callers filter on
 * {@link Incident#isActive()}.
 */
public interface IncidentSource {

    List<Incident> listActiveIncidents() throws SourceException;
}
