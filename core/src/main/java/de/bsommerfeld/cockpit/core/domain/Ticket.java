package de.bsommerfeld.cockpit.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Issue from the ticket tracker.
 *
 * @param id  internal tracker id
 * @param key human-facing identifier such as {@code PROJ-123}
 */
public record Ticket(
        String id,
        String key,
        String summary,
        String description,
        TicketStatus status,
        User assignee,
        User reporter,
        Priority priority,
        List<String> labels,
        Instant updatedAt,
        Instant createdAt) {

    public Ticket {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }
}
