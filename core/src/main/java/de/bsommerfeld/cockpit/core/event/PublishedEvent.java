package de.bsommerfeld.cockpit.core.event;

import java.time.Instant;

/**
 * History entry: an event together with the instant it was published.
 */
public record PublishedEvent(Instant publishedAt, CockpitEvent event) {
}
