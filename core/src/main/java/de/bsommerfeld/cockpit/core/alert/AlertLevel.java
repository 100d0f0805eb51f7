package de.bsommerfeld.cockpit.core.alert;

/**
 * Four-valued severity that drives passive notification surfaces such as a
 * tray icon. Declaration order is the severity order:
 * {@code NEUTRAL < GREEN < AMBER < RED}.
 */
public enum AlertLevel {

    /** Pending work exists, none of it stale. */
    NEUTRAL("Neutral", "#6B7280"),
    /** Nothing pending, all monitored systems nominal. */
    GREEN("All Clear", "#10B981"),
    /** Stale pull requests are waiting. */
    AMBER("Attention Needed", "#F59E0B"),
    /** At least one active incident. */
    RED("Critical", "#EF4444");

    private final String displayName;
    private final String colorHex;

    AlertLevel(String displayName, String colorHex) {
        this.displayName = displayName;
        this.colorHex = colorHex;
    }

    /**
     * Derives the level from raw counts. Rules are checked in order, the first
     * match wins: any active incident is {@link #RED}, any stale item is
     * {@link #AMBER}, no pending item is {@link #GREEN}, anything else is
     * {@link #NEUTRAL}.
     */
    public static AlertLevel compute(int activeIncidentCount, int staleCount, int pendingCount) {
        if (activeIncidentCount > 0)
            return RED;
        if (staleCount > 0)
            return AMBER;
        if (pendingCount == 0)
            return GREEN;
        return NEUTRAL;
    }

    /**
     * Returns the more severe of the two levels.
     */
    public AlertLevel combine(AlertLevel other) {
        return compareTo(other) >= 0 ? this : other;
    }

    public boolean isCritical() {
        return this == RED;
    }

    public boolean isWarning() {
        return this == AMBER;
    }

    public String displayName() {
        return displayName;
    }

    public String colorHex() {
        return colorHex;
    }
}
