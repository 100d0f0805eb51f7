package de.bsommerfeld.cockpit.core.alert;

import java.time.Instant;

/**
 * A recorded change of the alert level. Only created when {@code from} and
 * {@code to} differ.
 *
 * @param shouldNotify {@code true} when the level just entered
 *                     {@link AlertLevel#RED}; notification surfaces use this
 *                     to decide whether to grab attention
 */
public record AlertTransition(AlertLevel from, AlertLevel to, String reason, Instant at, boolean shouldNotify) {

    public static AlertTransition between(AlertLevel from, AlertLevel to, String reason, Instant at) {
        if (from == to)
            throw new IllegalArgumentException("Not a transition: " + from + " -> " + to);
        return new AlertTransition(from, to, reason, at, to.isCritical() && !from.isCritical());
    }
}
