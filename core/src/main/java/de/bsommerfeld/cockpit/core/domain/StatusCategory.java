package de.bsommerfeld.cockpit.core.domain;

public enum StatusCategory {
    TODO,
    IN_PROGRESS,
    DONE
}
