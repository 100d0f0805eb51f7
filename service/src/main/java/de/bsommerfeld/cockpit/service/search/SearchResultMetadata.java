package de.bsommerfeld.cockpit.service.search;

/**
 * Optional details shown next to a hit. Any field may be {@code null}.
 */
public record SearchResultMetadata(String status, String assignee, String priority, Boolean stale) {

    public static final SearchResultMetadata EMPTY = new SearchResultMetadata(null, null, null, null);
}
