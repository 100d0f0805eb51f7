package de.bsommerfeld.cockpit.service.pr;

public enum PrGrouping {
    BY_REPOSITORY,
    BY_AUTHOR,
    BY_AGE
}
