package de.bsommerfeld.cockpit.core.source;

/**
 * Full-text ticket search. Every field except {@code limit} is optional and
 * {@code null} when unset.
 */
public record TicketQuery(String text, String project, String assignee, String status, int limit) {

    public static final int DEFAULT_LIMIT = 10;

    public static TicketQuery text(String text) {
        return new TicketQuery(text, null, null, null, DEFAULT_LIMIT);
    }

    public TicketQuery withProject(String project) {
        return new TicketQuery(text, project, assignee, status, limit);
    }

    public TicketQuery withAssignee(String assignee) {
        return new TicketQuery(text, project, assignee, status, limit);
    }

    public TicketQuery withStatus(String status) {
        return new TicketQuery(text, project, assignee, status, limit);
    }

    public TicketQuery withLimit(int limit) {
        return new TicketQuery(text, project, assignee, status, limit);
    }
}
