package de.bsommerfeld.cockpit.service.incident;

import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.domain.Severity;

import java.util.List;
import java.util.Map;

/**
 * Counts over the currently firing incidents.
 *
 * @param mostSevere             highest severity among firing incidents,
 *                               {@code null} when none fire
 * @param longestDurationMinutes runtime of the longest firing incident,
 *                               {@code null} when none fire
 * @param activeIncidentIds      ids of the firing incidents, most severe first
 */
public record IncidentSummary(
        int totalActive,
        int criticalCount,
        int highCount,
        int mediumCount,
        int lowCount,
        Map<String, Integer> countsByService,
        Severity mostSevere,
        Long longestDurationMinutes,
        List<String> activeIncidentIds,
        AlertLevel alertLevel) {

    public IncidentSummary {
        countsByService = countsByService == null ? Map.of() : Map.copyOf(countsByService);
        activeIncidentIds = activeIncidentIds == null ? List.of() : List.copyOf(activeIncidentIds);
    }
}
