package de.bsommerfeld.cockpit.service.incident;

import de.bsommerfeld.cockpit.core.domain.Incident;
import de.bsommerfeld.cockpit.core.domain.Severity;

import java.util.List;

/**
 * Predicate over incidents.
 *
 * @param minSeverity lowest accepted severity, {@code null} for any
 * @param services    service allow-list, empty means all
 * @param activeOnly  drop resolved incidents
 */
public record IncidentFilter(Severity minSeverity, List<String> services, boolean activeOnly) {

    public IncidentFilter {
        services = services == null ? List.of() : List.copyOf(services);
    }

    /**
     * Every firing incident.
     */
    public static IncidentFilter active() {
        return new IncidentFilter(null, List.of(), true);
    }

    public IncidentFilter withMinSeverity(Severity severity) {
        return new IncidentFilter(severity, services, activeOnly);
    }

    public IncidentFilter withServices(List<String> services) {
        return new IncidentFilter(minSeverity, services, activeOnly);
    }

    public IncidentFilter includingResolved() {
        return new IncidentFilter(minSeverity, services, false);
    }

    public boolean matches(Incident incident) {
        if (minSeverity != null && !incident.severity().isAtLeast(minSeverity))
            return false;
        if (!services.isEmpty() && !services.contains(incident.service()))
            return false;
        return !activeOnly || incident.isActive();
    }
}
