package de.bsommerfeld.cockpit.core.alert;

import java.util.ArrayList;
import java.util.List;

/**
 * Counts that feed the alert level, plus an optional free-text message shown
 * when nothing else is worth mentioning.
 */
public record AlertStatus(int pendingPrs, int stalePrs, int activeIncidents, String message) {

    public static final AlertStatus EMPTY = new AlertStatus(0, 0, 0, null);

    public AlertStatus withPullRequests(int pending, int stale) {
        return new AlertStatus(pending, stale, activeIncidents, message);
    }

    public AlertStatus withIncidents(int active) {
        return new AlertStatus(pendingPrs, stalePrs, active, message);
    }

    public AlertStatus withMessage(String message) {
        return new AlertStatus(pendingPrs, stalePrs, activeIncidents, message);
    }

    public AlertLevel level() {
        return AlertLevel.compute(activeIncidents, stalePrs, pendingPrs);
    }

    /**
     * Human-readable one-liner, e.g. {@code "2 PRs waiting. 1 stale PR."}.
     */
    public String tooltip() {
        List<String> parts = new ArrayList<>();
        if (pendingPrs > 0)
            parts.add(plural(pendingPrs, "PR") + " waiting");
        if (stalePrs > 0)
            parts.add(plural(stalePrs, "stale PR"));
        if (activeIncidents > 0)
            parts.add(plural(activeIncidents, "active incident"));

        if (parts.isEmpty())
            return message != null ? message : "All systems nominal.";
        return String.join(". ", parts) + ".";
    }

    /**
     * Reason string attached to alert transitions.
     */
    public String describe() {
        return "Active incidents: " + activeIncidents + ", stale PRs: " + stalePrs
                + ", pending reviews: " + pendingPrs;
    }

    private static String plural(int count, String noun) {
        return count + " " + noun + (count == 1 ? "" : "s");
    }
}
