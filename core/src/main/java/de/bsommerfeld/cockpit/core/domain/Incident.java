package de.bsommerfeld.cockpit.core.domain;

import java.time.Instant;

/**
 * An alert raised by the monitoring platform.
 *
 * @param resolvedAt {@code null} while the incident is still firing
 * @param runbookUrl may be {@code null}
 */
public record Incident(
        String id,
        String service,
        Severity severity,
        IncidentStatus status,
        Instant startedAt,
        Instant resolvedAt,
        String description,
        String runbookUrl) {

    public boolean isActive() {
        return status == IncidentStatus.FIRING;
    }
}
