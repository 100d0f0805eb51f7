package de.bsommerfeld.cockpit.core.domain;

/**
 * Workflow status of a ticket. {@code name} is the tracker's own label
 * ("In Review", "Blocked"...), {@code category} the normalized bucket.
 */
public record TicketStatus(String name, StatusCategory category) {
}
