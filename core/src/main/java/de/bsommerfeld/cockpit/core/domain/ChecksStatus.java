package de.bsommerfeld.cockpit.core.domain;

/** CI status reported for a pull request's head commit. */
public enum ChecksStatus {
    PASS,
    FAIL,
    RUNNING,
    NONE
}
