package de.bsommerfeld.cockpit.service.search;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.cache.CacheException;
import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.config.CacheConfig;
import de.bsommerfeld.cockpit.core.config.PullRequestConfig;
import de.bsommerfeld.cockpit.core.config.SearchConfig;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.domain.StatusCategory;
import de.bsommerfeld.cockpit.core.domain.Ticket;
import de.bsommerfeld.cockpit.core.event.ApplicationEventBus;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.SearchCompleted;
import de.bsommerfeld.cockpit.core.source.PullRequestFilter;
import de.bsommerfeld.cockpit.core.source.PullRequestSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import de.bsommerfeld.cockpit.core.source.TicketQuery;
import de.bsommerfeld.cockpit.core.source.TicketSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Unified search over tickets and open pull requests.
 *
 * <h3>Lookup</h3>
 * A query shaped like a ticket id ({@code PROJ-123}) is first tried as a
 * direct lookup of the upper-cased id. A hit is the only ticket result and
 * starts at relevance {@value #DIRECT_HIT_SCORE}; a not-found answer falls
 * back to full-text search, any other failure propagates. Text matches start
 * at {@value #TEXT_MATCH_SCORE}.
 *
 * <h3>Ranking</h3>
 * Every result is multiplied by a recency factor (x1.5 under an hour, x1.2
 * under a day, x1.0 under a week, x0.8 beyond) and by an id match factor (x2.0
 * exact, x1.5 substring, case-insensitive). Results are sorted by descending
 * score and cut to the query limit.
 *
 * <h3>Caching</h3>
 * Ranked lists are cached under {@code "search:" + text}, so two queries with
 * the same text share one entry regardless of their other parameters.
 */
@Singleton
public class SearchService {

    private static final Logger LOG = LoggerFactory.getLogger(SearchService.class);

    static final double DIRECT_HIT_SCORE = 2.0;
    static final double TEXT_MATCH_SCORE = 1.0;

    private static final String KEY_PREFIX = "search:";
    private static final TypeReference<List<SearchResult>> RESULT_LIST = new TypeReference<>() {
    };

    private final TicketSource tickets;
    private final PullRequestSource pullRequests;
    private final TieredCache cache;
    private final SearchConfig config;
    private final PullRequestConfig pullRequestConfig;
    private final Duration resultTtl;
    private final ApplicationEventBus eventBus;
    private final Clock clock;

    @Inject
    public SearchService(TicketSource tickets, PullRequestSource pullRequests, TieredCache cache, SearchConfig config,
            PullRequestConfig pullRequestConfig, CacheConfig cacheConfig, ApplicationEventBus eventBus, Clock clock) {
        this(tickets, pullRequests, cache, config, pullRequestConfig, cacheConfig.getTicketSearchTtl(), eventBus,
                clock);
    }

    /**
     * @param pullRequests may be {@code null} to search tickets only
     * @param cache        may be {@code null}
     * @param eventBus     may be {@code null}
     */
    public SearchService(TicketSource tickets, PullRequestSource pullRequests, TieredCache cache, SearchConfig config,
            PullRequestConfig pullRequestConfig, Duration resultTtl, ApplicationEventBus eventBus, Clock clock) {
        this.tickets = tickets;
        this.pullRequests = pullRequests;
        this.cache = cache;
        this.config = config;
        this.pullRequestConfig = pullRequestConfig;
        this.resultTtl = resultTtl;
        this.eventBus = eventBus;
        this.clock = clock;
    }

    public List<SearchResult> search(String text) throws SourceException {
        return search(SearchQuery.of(text).withLimit(config.getDefaultLimit()));
    }

    public List<SearchResult> search(SearchQuery query) throws SourceException {
        long started = System.nanoTime();
        String key = KEY_PREFIX + query.text();

        List<SearchResult> results = cachedResults(key);
        if (results == null) {
            results = rank(collect(query), query);
            store(key, results);
        } else {
            LOG.debug("Search cache hit for '{}'", query.text());
        }

        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        if (eventBus != null)
            eventBus.publish(new SearchCompleted(query.text(), results.size(), durationMs));
        return results;
    }

    private List<SearchResult> collect(SearchQuery query) throws SourceException {
        int limit = effectiveLimit(query);
        List<SearchResult> found = new ArrayList<>();
        if (query.includes(SearchResultType.TICKET))
            found.addAll(searchTickets(query, limit));
        if (query.includes(SearchResultType.PULL_REQUEST) && pullRequests != null)
            found.addAll(searchPullRequests(query));
        return found;
    }

    private List<SearchResult> searchTickets(SearchQuery query, int limit) throws SourceException {
        String browseUrl = config.getTicketBrowseUrl();
        if (query.isTicketId()) {
            String id = query.text().trim().toUpperCase(Locale.ROOT);
            try {
                Ticket ticket = tickets.findById(id);
                return List.of(SearchResult.fromTicket(ticket, browseUrl, DIRECT_HIT_SCORE));
            } catch (SourceException e) {
                if (!e.isNotFound())
                    throw e;
                LOG.debug("No ticket {}, falling back to text search", id);
            }
        }

        List<SearchResult> results = new ArrayList<>();
        for (Ticket ticket : tickets.search(TicketQuery.text(query.text()).withLimit(limit))) {
            if (!query.includeClosed() && isDone(ticket))
                continue;
            results.add(SearchResult.fromTicket(ticket, browseUrl, TEXT_MATCH_SCORE));
        }
        return results;
    }

    private List<SearchResult> searchPullRequests(SearchQuery query) throws SourceException {
        PullRequestFilter filter = PullRequestFilter.defaults()
                .withRepositories(pullRequestConfig.getRepositories())
                .withLimit(pullRequestConfig.getFetchLimit());
        Instant now = clock.instant();
        Duration threshold = Duration.ofHours(pullRequestConfig.getStaleThresholdHours());
        String needle = query.text().trim().toLowerCase(Locale.ROOT);
        String number = query.isPullRequestNumber() ? needle.substring(1) : null;

        List<SearchResult> results = new ArrayList<>();
        for (PullRequest pr : pullRequests.listOpen(filter)) {
            double base;
            if (number != null && number.equals(pr.id()))
                base = DIRECT_HIT_SCORE;
            else if (!needle.isEmpty() && matchesText(pr, needle))
                base = TEXT_MATCH_SCORE;
            else
                continue;
            boolean stale = Duration.between(pr.updatedAt(), now).compareTo(threshold) > 0;
            results.add(SearchResult.fromPullRequest(pr, stale, base));
        }
        return results;
    }

    private static boolean matchesText(PullRequest pr, String needle) {
        return contains(pr.title(), needle) || contains(pr.id(), needle) || contains(pr.description(), needle);
    }

    private static boolean contains(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean isDone(Ticket ticket) {
        return ticket.status() != null && ticket.status().category() == StatusCategory.DONE;
    }

    List<SearchResult> rank(List<SearchResult> results, SearchQuery query) {
        Instant now = clock.instant();
        for (SearchResult result : results) {
            result.boostForRecency(now);
            result.boostForIdMatch(query.text());
        }
        List<SearchResult> ranked = new ArrayList<>(results);
        ranked.sort(Comparator.comparingDouble(SearchResult::getRelevanceScore).reversed());
        int limit = effectiveLimit(query);
        return ranked.size() > limit ? List.copyOf(ranked.subList(0, limit)) : List.copyOf(ranked);
    }

    private int effectiveLimit(SearchQuery query) {
        return query.limit() > 0 ? query.limit() : config.getDefaultLimit();
    }

    private List<SearchResult> cachedResults(String key) {
        if (cache == null)
            return null;
        try {
            return cache.get(key, RESULT_LIST);
        } catch (CacheException e) {
            if (!e.isMiss())
                LOG.warn("Search cache read failed ({}) for '{}'", e.getReason(), key);
            return null;
        }
    }

    private void store(String key, List<SearchResult> results) {
        if (cache == null)
            return;
        try {
            cache.set(key, results, resultTtl);
        } catch (CacheException e) {
            LOG.warn("Could not cache search results for '{}': {}", key, e.getMessage());
        }
    }
}
