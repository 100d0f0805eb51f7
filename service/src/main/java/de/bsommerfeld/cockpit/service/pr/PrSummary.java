package de.bsommerfeld.cockpit.service.pr;

import de.bsommerfeld.cockpit.core.alert.AlertLevel;

import java.util.Map;

/**
 * Snapshot of the open pull requests, always computed from the full list.
 *
 * @param oldestStaleAgeHours age of the oldest stale PR, {@code null} when
 *                            nothing is stale
 * @param alertLevel          level derived from stale and pending counts
 *                            alone
 */
public record PrSummary(
        int totalOpen,
        int pendingReview,
        int staleCount,
        Map<String, Integer> countsByRepository,
        Long oldestStaleAgeHours,
        AlertLevel alertLevel) {

    public PrSummary {
        countsByRepository = countsByRepository == null ? Map.of() : Map.copyOf(countsByRepository);
    }
}
