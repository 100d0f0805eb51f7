package de.bsommerfeld.cockpit.app.source;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.core.domain.Ticket;
import de.bsommerfeld.cockpit.core.source.SourceException;
import de.bsommerfeld.cockpit.core.source.TicketQuery;
import de.bsommerfeld.cockpit.core.source.TicketSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Offline {@link TicketSource} for TEST mode. Text search is a
 * case-insensitive substring match over key, summary and description.
 */
@Singleton
public class TestTicketSource implements TicketSource {

    private static final Logger LOG = LoggerFactory.getLogger(TestTicketSource.class);

    static final int TICKET_COUNT = 25;

    private final List<Ticket> tickets;

    @Inject
    public TestTicketSource(Clock clock) {
        this(TestDataGenerator.generateTickets(TICKET_COUNT, clock.instant()));
    }

    TestTicketSource(List<Ticket> tickets) {
        this.tickets = List.copyOf(tickets);
        LOG.warn("TEST MODE: serving {} generated tickets", this.tickets.size());
    }

    @Override
    public Ticket findById(String id) throws SourceException {
        return tickets.stream()
                .filter(t -> t.key().equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> SourceException.notFound(id));
    }

    @Override
    public List<Ticket> search(TicketQuery query) {
        LOG.debug("[TEST] Searching tickets for '{}'", query.text());
        String needle = query.text() != null ? query.text().trim().toLowerCase(Locale.ROOT) : "";
        return tickets.stream()
                .filter(t -> needle.isEmpty() || contains(t.key(), needle) || contains(t.summary(), needle)
                        || contains(t.description(), needle))
                .filter(t -> query.project() == null || t.key().startsWith(query.project() + "-"))
                .filter(t -> query.assignee() == null
                        || (t.assignee() != null && query.assignee().equals(t.assignee().id())))
                .filter(t -> query.status() == null
                        || (t.status() != null && query.status().equalsIgnoreCase(t.status().name())))
                .limit(Math.max(query.limit(), 0))
                .collect(Collectors.toList());
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
