package de.bsommerfeld.cockpit.service.search;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * @param types         result types to look for
 * @param limit         maximum number of ranked results
 * @param includeClosed keep tickets whose status is done
 */
public record SearchQuery(String text, List<SearchResultType> types, int limit, boolean includeClosed) {

    public static final int DEFAULT_LIMIT = 10;

    private static final Pattern TICKET_ID = Pattern.compile("^[A-Z]+-\\d+$");
    private static final Pattern PR_NUMBER = Pattern.compile("^#\\d+$");

    public SearchQuery {
        if (text == null)
            throw new IllegalArgumentException("text must not be null");
        types = types == null ? List.of() : List.copyOf(types);
    }

    /**
     * Tickets and pull requests, default limit, open items only.
     */
    public static SearchQuery of(String text) {
        return new SearchQuery(text, List.of(SearchResultType.TICKET, SearchResultType.PULL_REQUEST),
                DEFAULT_LIMIT, false);
    }

    public SearchQuery withTypes(List<SearchResultType> types) {
        return new SearchQuery(text, types, limit, includeClosed);
    }

    public SearchQuery withLimit(int limit) {
        return new SearchQuery(text, types, limit, includeClosed);
    }

    public SearchQuery includingClosed() {
        return new SearchQuery(text, types, limit, true);
    }

    public boolean includes(SearchResultType type) {
        return types.contains(type);
    }

    /**
     * {@code true} for texts shaped like {@code PROJ-123}, case-insensitive.
     */
    public boolean isTicketId() {
        return TICKET_ID.matcher(text.trim().toUpperCase(Locale.ROOT)).matches();
    }

    /**
     * {@code true} for texts shaped like {@code #42}.
     */
    public boolean isPullRequestNumber() {
        return PR_NUMBER.matcher(text.trim()).matches();
    }
}
