package de.bsommerfeld.cockpit.service.poll;

/**
 * A domain is {@code POLLING} while one tick runs and {@code IDLE} otherwise.
 * The outcome of the last tick is kept in {@link DomainState}.
 */
public enum DomainPhase {
    IDLE,
    POLLING
}
