package de.bsommerfeld.cockpit.service.search;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.domain.Ticket;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * One ranked search hit. The relevance score is only adjusted by
 * {@link SearchService} while ranking; instances handed to callers are not
 * modified afterwards.
 */
public final class SearchResult {

    private final String id;
    private final SearchResultType type;
    private final String title;
    private final String subtitle;
    private final String url;
    private double relevanceScore;
    private final Instant updatedAt;
    private final SearchResultMetadata metadata;

    @JsonCreator
    public SearchResult(
            @JsonProperty("id") String id,
            @JsonProperty("type") SearchResultType type,
            @JsonProperty("title") String title,
            @JsonProperty("subtitle") String subtitle,
            @JsonProperty("url") String url,
            @JsonProperty("relevanceScore") double relevanceScore,
            @JsonProperty("updatedAt") Instant updatedAt,
            @JsonProperty("metadata") SearchResultMetadata metadata) {
        this.id = id;
        this.type = type;
        this.title = title;
        this.subtitle = subtitle;
        this.url = url;
        this.relevanceScore = relevanceScore;
        this.updatedAt = updatedAt;
        this.metadata = metadata != null ? metadata : SearchResultMetadata.EMPTY;
    }

    /**
     * @param browseUrl base URL tickets are opened under, may be {@code null}
     */
    static SearchResult fromTicket(Ticket ticket, String browseUrl, double baseScore) {
        String status = ticket.status() != null ? ticket.status().name() : null;
        String url = browseUrl != null ? trimSlash(browseUrl) + "/" + ticket.key() : null;
        return new SearchResult(
                ticket.key(),
                SearchResultType.TICKET,
                ticket.summary(),
                status != null ? ticket.key() + " • " + status : ticket.key(),
                url,
                baseScore,
                ticket.updatedAt(),
                new SearchResultMetadata(
                        status,
                        ticket.assignee() != null ? ticket.assignee().name() : null,
                        ticket.priority() != null ? ticket.priority().label() : null,
                        null));
    }

    static SearchResult fromPullRequest(PullRequest pr, boolean stale, double baseScore) {
        String state = pr.state() != null ? pr.state().label() : null;
        return new SearchResult(
                pr.id(),
                SearchResultType.PULL_REQUEST,
                pr.title(),
                pr.sourceBranch() + " → " + pr.targetBranch() + (state != null ? " • " + state : ""),
                pr.url(),
                baseScore,
                pr.updatedAt(),
                new SearchResultMetadata(state, null, null, stale));
    }

    private static String trimSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    void boostForRecency(Instant now) {
        Instant updated = updatedAt != null ? updatedAt : Instant.EPOCH;
        Duration age = Duration.between(updated, now);
        if (age.compareTo(Duration.ofHours(1)) < 0)
            relevanceScore *= 1.5;
        else if (age.compareTo(Duration.ofHours(24)) < 0)
            relevanceScore *= 1.2;
        else if (age.compareTo(Duration.ofDays(7)) >= 0)
            relevanceScore *= 0.8;
    }

    void boostForIdMatch(String query) {
        String needle = query.trim().toLowerCase(Locale.ROOT);
        String haystack = id.toLowerCase(Locale.ROOT);
        if (haystack.equals(needle))
            relevanceScore *= 2.0;
        else if (!needle.isEmpty() && haystack.contains(needle))
            relevanceScore *= 1.5;
    }

    public String getId() {
        return id;
    }

    public SearchResultType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getSubtitle() {
        return subtitle;
    }

    public String getUrl() {
        return url;
    }

    public double getRelevanceScore() {
        return relevanceScore;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public SearchResultMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SearchResult))
            return false;
        SearchResult other = (SearchResult) o;
        return id.equals(other.id) && type == other.type;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return type.label() + " " + id + " (" + relevanceScore + ")";
    }
}
