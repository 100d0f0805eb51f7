package de.bsommerfeld.cockpit.core.event;

import de.bsommerfeld.cockpit.core.alert.AlertLevel;

import java.time.Instant;
import java.util.List;

/**
 * All events produced by the cockpit core. Producers create them at the moment
 * of a state change; nobody mutates them afterwards.
 */
public final class CockpitEvents {

    private CockpitEvents() {
    }

    public record AlertLevelChanged(AlertLevel from, AlertLevel to, String reason) implements CockpitEvent {
    }

    /**
     * @param fromCache {@code true} when the poll failed and the numbers come
     *                  from the last known (possibly expired) summary
     */
    public record PullRequestsUpdated(int totalOpen, int staleCount, int pendingReview, boolean fromCache)
            implements CockpitEvent {
    }

    public record IncidentsUpdated(int activeCount, int criticalCount, List<String> newIncidentIds)
            implements CockpitEvent {
        public IncidentsUpdated {
            newIncidentIds = List.copyOf(newIncidentIds);
        }
    }

    public record SearchCompleted(String query, int resultCount, long durationMs) implements CockpitEvent {
    }

    public record CacheInvalidated(String cacheType, List<String> keys, int count) implements CockpitEvent {
        public CacheInvalidated {
            keys = List.copyOf(keys);
        }
    }

    public record SettingsChanged(String section) implements CockpitEvent {
    }

    public record ErrorOccurred(String source, String message, boolean recoverable) implements CockpitEvent {
    }

    public record PollTick(String domain, Instant timestamp, boolean success) implements CockpitEvent {
    }
}
