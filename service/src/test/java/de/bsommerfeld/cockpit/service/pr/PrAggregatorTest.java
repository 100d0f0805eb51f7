package de.bsommerfeld.cockpit.service.pr;

import de.bsommerfeld.cockpit.cache.TieredCache;
import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.config.PullRequestConfig;
import de.bsommerfeld.cockpit.core.domain.ChecksStatus;
import de.bsommerfeld.cockpit.core.domain.PrState;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.domain.Reviewer;
import de.bsommerfeld.cockpit.core.domain.User;
import de.bsommerfeld.cockpit.core.source.PullRequestFilter;
import de.bsommerfeld.cockpit.core.source.PullRequestSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import de.bsommerfeld.cockpit.service.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PrAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");

    @Mock
    PullRequestSource source;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private PullRequestConfig config;
    private PrAggregator aggregator;

    @BeforeEach
    void setUp() {
        config = new PullRequestConfig();
        config.setUserId("u-1");
        aggregator = new PrAggregator(source, null, config, Duration.ofMinutes(2), clock);
    }

    // -- Staleness --

    @Test
    void isStale_shouldUseFortyEightHourThreshold() {
        assertTrue(aggregator.isStale(pr("1", "core", 49), NOW));
        assertFalse(aggregator.isStale(pr("2", "core", 47), NOW));
        assertFalse(aggregator.isStale(pr("3", "core", 48), NOW));
    }

    @Test
    void isStale_shouldFollowConfiguredThreshold() {
        config.setStaleThresholdHours(24);

        assertTrue(aggregator.isStale(pr("1", "core", 25), NOW));
    }

    @Test
    void getStalePullRequests_shouldFilterLiveList() throws Exception {
        when(source.listOpen(any())).thenReturn(List.of(pr("1", "core", 49), pr("2", "core", 47)));

        List<PullRequest> stale = aggregator.getStalePullRequests();

        assertEquals(1, stale.size());
        assertEquals("1", stale.get(0).id());
    }

    // -- Summary --

    @Test
    void getSummary_shouldCountOpenStaleAndPending() throws Exception {
        when(source.listOpen(any())).thenReturn(List.of(
                pr("1", "core", 72, reviewer("u-1", "Ann")),
                pr("2", "core", 50),
                pr("3", "web", 1, reviewer("u-2", "Bob"), reviewer("u-1", "Ann"))));

        PrSummary summary = aggregator.getSummary();

        assertEquals(3, summary.totalOpen());
        assertEquals(2, summary.staleCount());
        assertEquals(2, summary.pendingReview());
        assertEquals(Map.of("core", 2, "web", 1), summary.countsByRepository());
        assertEquals(72L, summary.oldestStaleAgeHours());
        assertEquals(AlertLevel.AMBER, summary.alertLevel());
    }

    @Test
    void getSummary_shouldReportGreenWhenNothingIsOpen() throws Exception {
        when(source.listOpen(any())).thenReturn(List.of());

        PrSummary summary = aggregator.getSummary();

        assertEquals(0, summary.totalOpen());
        assertNull(summary.oldestStaleAgeHours());
        assertEquals(AlertLevel.GREEN, summary.alertLevel());
    }

    @Test
    void getSummary_shouldReportNeutralWhenReviewsArePending() throws Exception {
        when(source.listOpen(any())).thenReturn(List.of(pr("1", "core", 2, reviewer("u-1", "Ann"))));

        assertEquals(AlertLevel.NEUTRAL, aggregator.getSummary().alertLevel());
    }

    @Test
    void getSummary_shouldMatchReviewerByNameOnlyWhenEnabled() throws Exception {
        when(source.listOpen(any())).thenReturn(List.of(pr("1", "core", 2, reviewer("other-id", "u-1"))));

        assertEquals(1, aggregator.getSummary().pendingReview());

        config.setMatchReviewerByName(false);
        assertEquals(0, aggregator.getSummary().pendingReview());
    }

    @Test
    void getSummary_shouldPropagateSourceFailure() throws Exception {
        when(source.listOpen(any())).thenThrow(new SourceException(SourceException.Kind.NETWORK, "offline"));

        SourceException e = assertThrows(SourceException.class, () -> aggregator.getSummary());
        assertEquals(SourceException.Kind.NETWORK, e.getKind());
    }

    // -- Caching --

    @Test
    void getSummary_shouldServeRepeatCallsFromCache() throws Exception {
        TieredCache cache = new TieredCache(10, null, clock, Duration.ofSeconds(1));
        var cached = new PrAggregator(source, cache, config, Duration.ofMinutes(2), clock);
        when(source.listOpen(any())).thenReturn(List.of(pr("1", "core", 49)));

        PrSummary first = cached.getSummary();
        PrSummary second = cached.getSummary();

        assertEquals(first, second);
        verify(source, times(1)).listOpen(any());
        assertTrue(cache.exists(PrAggregator.SUMMARY_KEY));
    }

    @Test
    void getLastKnownSummary_shouldIgnoreExpiry() throws Exception {
        TieredCache cache = new TieredCache(10, null, clock, Duration.ofSeconds(1));
        var expiring = new PrAggregator(source, cache, config, Duration.ZERO, clock);
        when(source.listOpen(any())).thenReturn(List.of(pr("1", "core", 49)));

        PrSummary summary = expiring.getSummary();

        assertEquals(summary, expiring.getLastKnownSummary().orElseThrow());
        assertFalse(cache.exists(PrAggregator.SUMMARY_KEY));
    }

    @Test
    void getLastKnownSummary_shouldSurviveExpiredEntryAfterFailedRefresh() throws Exception {
        MutableClock moving = new MutableClock(NOW);
        TieredCache cache = new TieredCache(10, null, moving, Duration.ofHours(1));
        var refreshing = new PrAggregator(source, cache, config, Duration.ofMinutes(2), moving);
        when(source.listOpen(any()))
                .thenReturn(List.of(pr("1", "core", 49)))
                .thenThrow(new SourceException(SourceException.Kind.NETWORK, "offline"));

        PrSummary summary = refreshing.getSummary();
        moving.advance(Duration.ofSeconds(121));

        assertThrows(SourceException.class, refreshing::getSummary);
        assertFalse(cache.exists(PrAggregator.SUMMARY_KEY));
        assertEquals(summary, refreshing.getLastKnownSummary().orElseThrow());
    }

    @Test
    void getLastKnownSummary_shouldBeEmptyWithoutCache() {
        assertTrue(aggregator.getLastKnownSummary().isEmpty());
    }

    // -- Source Queries --

    @Test
    void fetchAllOpen_shouldApplyConfiguredRepositoriesAndLimit() throws Exception {
        config.setRepositories(List.of("core"));
        when(source.listOpen(any())).thenReturn(List.of());

        aggregator.fetchAllOpen();

        ArgumentCaptor<PullRequestFilter> filter = ArgumentCaptor.forClass(PullRequestFilter.class);
        verify(source).listOpen(filter.capture());
        assertEquals(List.of("core"), filter.getValue().repositories());
        assertEquals(config.getFetchLimit(), filter.getValue().limit());
    }

    @Test
    void getPendingReview_shouldAskSourceForConfiguredUser() throws Exception {
        when(source.findByReviewer(eq("u-1"), any())).thenReturn(List.of(pr("1", "core", 1)));

        assertEquals(1, aggregator.getPendingReview().size());
    }

    @Test
    void getPendingReview_shouldBeEmptyWithoutUser() throws Exception {
        config.setUserId(null);

        assertTrue(aggregator.getPendingReview().isEmpty());
        verify(source, never()).findByReviewer(anyString(), any());
    }

    // -- Grouping --

    @Test
    void group_shouldOrderByStaleCountAndKeepFirstSeenOrderOnTies() {
        List<PullRequest> prs = List.of(
                pr("1", "web", 1),
                pr("2", "api", 2),
                pr("3", "core", 60),
                pr("4", "core", 70),
                pr("5", "api", 3));

        List<PrGroup> groups = aggregator.group(prs, PrGrouping.BY_REPOSITORY);

        assertEquals(List.of("core", "web", "api"), labels(groups));
        assertEquals(2, groups.get(0).staleCount());
        assertEquals(2, groups.get(2).pullRequests().size());
    }

    @Test
    void group_shouldBucketByAge() {
        List<PrGroup> groups = aggregator.group(
                List.of(pr("1", "a", 2), pr("2", "a", 30), pr("3", "a", 100), pr("4", "a", 200)),
                PrGrouping.BY_AGE);

        assertEquals(List.of("2-7 days", "> 7 days", "< 24 hours", "24-48 hours"), labels(groups));
    }

    @Test
    void group_shouldUseAuthorName() {
        List<PrGroup> groups = aggregator.group(List.of(pr("1", "a", 1), pr("2", "b", 1)), PrGrouping.BY_AUTHOR);

        assertEquals(1, groups.size());
        assertEquals("Author", groups.get(0).label());
    }

    @Test
    void ageBucket_shouldUseHalfOpenRanges() {
        assertEquals("< 24 hours", PrAggregator.ageBucket(Duration.ofHours(23)));
        assertEquals("24-48 hours", PrAggregator.ageBucket(Duration.ofHours(24)));
        assertEquals("2-7 days", PrAggregator.ageBucket(Duration.ofHours(48)));
        assertEquals("> 7 days", PrAggregator.ageBucket(Duration.ofDays(7)));
    }

    private static PullRequest pr(String id, String repository, long hoursAgo, Reviewer... reviewers) {
        Instant updated = NOW.minus(Duration.ofHours(hoursAgo));
        return new PullRequest(id, repository, "PR " + id, null, PrState.OPEN, new User("a-1", "Author"),
                List.of(reviewers), "feature/" + id, "main", ChecksStatus.PASS, updated, updated,
                "https://git.example.com/" + repository + "/pr/" + id);
    }

    private static List<String> labels(List<PrGroup> groups) {
        return groups.stream().map(PrGroup::label).collect(Collectors.toList());
    }

    private static Reviewer reviewer(String id, String name) {
        return new Reviewer(new User(id, name), false);
    }
}
