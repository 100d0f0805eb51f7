package de.bsommerfeld.cockpit.core.source;

import de.bsommerfeld.cockpit.core.domain.Ticket;

import java.util.List;

/**
 * Ticket-tracker capability consumed by the search service.
 */
public interface TicketSource {

    /**
     * @param id ticket key such as {@code PROJ-123}
     * @throws SourceException with {@link SourceException.Kind#NOT_FOUND} if
     *                         no such ticket exists
     */
    Ticket findById(String id) throws SourceException;

    List<Ticket> search(TicketQuery query) throws SourceException;
}
