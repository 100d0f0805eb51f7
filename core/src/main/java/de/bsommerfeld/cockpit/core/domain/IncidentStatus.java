package de.bsommerfeld.cockpit.core.domain;

public enum IncidentStatus {
    FIRING,
    RESOLVED
}
