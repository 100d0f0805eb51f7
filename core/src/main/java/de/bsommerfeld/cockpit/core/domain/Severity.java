package de.bsommerfeld.cockpit.core.domain;

/**
 * Incident severity. Declaration order is the severity order, so
 * {@link #compareTo} and {@code max} pick the most severe value.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
