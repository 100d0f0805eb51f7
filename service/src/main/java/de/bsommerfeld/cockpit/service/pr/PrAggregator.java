package de.bsommerfeld.cockpit.service.pr;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.cache.CacheException;
import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.config.CacheConfig;
import de.bsommerfeld.cockpit.core.config.PullRequestConfig;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.domain.Reviewer;
import de.bsommerfeld.cockpit.core.source.PullRequestFilter;
import de.bsommerfeld.cockpit.core.source.PullRequestSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Aggregates open pull requests from a {@link PullRequestSource} into a
 * {@link PrSummary}.
 *
 * <h3>Caching</h3>
 * {@link #getSummary()} is cache-aside on key {@value #SUMMARY_KEY}. Every
 * other read goes to the source directly so callers asking for stale or
 * pending PRs always see the live list.
 *
 * <h3>Reviewer matching</h3>
 * A PR counts as pending for the configured user when one of its reviewers
 * has that user id. With {@code match-reviewer-by-name} enabled the reviewer's
 * display name is accepted as well; such matches are logged because two
 * people can share a display name.
 */
@Singleton
public class PrAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(PrAggregator.class);

    public static final String SUMMARY_KEY = "pr_summary";

    private final PullRequestSource source;
    private final TieredCache cache;
    private final PullRequestConfig config;
    private final Duration summaryTtl;
    private final Clock clock;

    // last summary handed out; survives eviction of the cache entry
    private final AtomicReference<PrSummary> lastSummary = new AtomicReference<>();

    @Inject
    public PrAggregator(PullRequestSource source, TieredCache cache, PullRequestConfig config,
            CacheConfig cacheConfig, Clock clock) {
        this(source, cache, config, cacheConfig.getPrListTtl(), clock);
    }

    /**
     * @param cache may be {@code null}, every summary is then computed live
     */
    public PrAggregator(PullRequestSource source, TieredCache cache, PullRequestConfig config, Duration summaryTtl,
            Clock clock) {
        this.source = source;
        this.cache = cache;
        this.config = config;
        this.summaryTtl = summaryTtl;
        this.clock = clock;
    }

    public PrSummary getSummary() throws SourceException {
        if (cache != null) {
            try {
                PrSummary cached = cache.get(SUMMARY_KEY, PrSummary.class);
                lastSummary.set(cached);
                return cached;
            } catch (CacheException e) {
                if (!e.isMiss())
                    LOG.warn("PR summary cache read failed ({}), fetching live", e.getReason());
            }
        }

        PrSummary summary = computeSummary(fetchAllOpen());
        lastSummary.set(summary);

        if (cache != null) {
            try {
                cache.set(SUMMARY_KEY, summary, summaryTtl);
            } catch (CacheException e) {
                LOG.warn("Could not cache PR summary: {}", e.getMessage());
            }
        }
        return summary;
    }

    /**
     * Last summary seen, even if its cache entry has expired or been evicted.
     */
    public Optional<PrSummary> getLastKnownSummary() {
        if (cache != null) {
            Optional<PrSummary> stale = cache.getStale(SUMMARY_KEY, PrSummary.class);
            if (stale.isPresent())
                return stale;
        }
        return Optional.ofNullable(lastSummary.get());
    }

    public List<PullRequest> fetchAllOpen() throws SourceException {
        return source.listOpen(baseFilter());
    }

    /**
     * PRs the configured user is asked to review, straight from the source.
     * Empty when no user is configured.
     */
    public List<PullRequest> getPendingReview() throws SourceException {
        String userId = config.getUserId();
        if (userId == null || userId.isBlank())
            return List.of();
        return source.findByReviewer(userId, baseFilter());
    }

    /**
     * Recomputed from a live fetch, never from the cached summary.
     */
    public List<PullRequest> getStalePullRequests() throws SourceException {
        Instant now = clock.instant();
        return fetchAllOpen().stream()
                .filter(pr -> isStale(pr, now))
                .collect(Collectors.toList());
    }

    /**
     * Groups {@code pullRequests} and orders the groups by stale count,
     * highest first. Groups with equal counts keep the order in which their
     * first member appeared.
     */
    public List<PrGroup> group(List<PullRequest> pullRequests, PrGrouping grouping) {
        Instant now = clock.instant();
        Map<String, List<PullRequest>> buckets = new LinkedHashMap<>();
        for (PullRequest pr : pullRequests) {
            buckets.computeIfAbsent(groupKey(pr, grouping, now), k -> new ArrayList<>()).add(pr);
        }

        List<PrGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<PullRequest>> bucket : buckets.entrySet()) {
            int stale = (int) bucket.getValue().stream().filter(pr -> isStale(pr, now)).count();
            groups.add(new PrGroup(bucket.getKey(), bucket.getValue(), stale));
        }
        groups.sort(Comparator.comparingInt(PrGroup::staleCount).reversed());
        return groups;
    }

    /**
     * A PR is stale once it has gone without an update for longer than the
     * configured threshold.
     */
    public boolean isStale(PullRequest pr, Instant now) {
        return Duration.between(pr.updatedAt(), now).compareTo(staleThreshold()) > 0;
    }

    PrSummary computeSummary(List<PullRequest> pullRequests) {
        Instant now = clock.instant();
        int stale = 0;
        Long oldestStaleHours = null;
        int pending = 0;
        Map<String, Integer> byRepository = new LinkedHashMap<>();

        for (PullRequest pr : pullRequests) {
            byRepository.merge(pr.repository(), 1, Integer::sum);
            if (isStale(pr, now)) {
                stale++;
                long hours = Duration.between(pr.updatedAt(), now).toHours();
                if (oldestStaleHours == null || hours > oldestStaleHours)
                    oldestStaleHours = hours;
            }
            if (isPendingReviewFor(pr, config.getUserId()))
                pending++;
        }

        return new PrSummary(pullRequests.size(), pending, stale, byRepository, oldestStaleHours,
                AlertLevel.compute(0, stale, pending));
    }

    boolean isPendingReviewFor(PullRequest pr, String userId) {
        if (userId == null || userId.isBlank())
            return false;
        for (Reviewer reviewer : pr.reviewers()) {
            if (reviewer.user() == null)
                continue;
            if (userId.equals(reviewer.user().id()))
                return true;
            if (config.isMatchReviewerByName() && userId.equals(reviewer.user().name())) {
                LOG.warn("PR {} matched reviewer '{}' by display name, not by id", pr.id(), userId);
                return true;
            }
        }
        return false;
    }

    private String groupKey(PullRequest pr, PrGrouping grouping, Instant now) {
        switch (grouping) {
            case BY_REPOSITORY:
                return pr.repository();
            case BY_AUTHOR:
                return pr.author() != null ? pr.author().name() : "unknown";
            case BY_AGE:
                return ageBucket(Duration.between(pr.updatedAt(), now));
            default:
                throw new IllegalArgumentException("Unknown grouping: " + grouping);
        }
    }

    static String ageBucket(Duration age) {
        if (age.compareTo(Duration.ofHours(24)) < 0)
            return "< 24 hours";
        if (age.compareTo(Duration.ofHours(48)) < 0)
            return "24-48 hours";
        if (age.compareTo(Duration.ofDays(7)) < 0)
            return "2-7 days";
        return "> 7 days";
    }

    private Duration staleThreshold() {
        return Duration.ofHours(config.getStaleThresholdHours());
    }

    private PullRequestFilter baseFilter() {
        return PullRequestFilter.defaults()
                .withRepositories(config.getRepositories())
                .withLimit(config.getFetchLimit());
    }
}
