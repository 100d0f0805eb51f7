package de.bsommerfeld.cockpit.app.source;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.cockpit.core.domain.PullRequest;
import de.bsommerfeld.cockpit.core.source.PullRequestFilter;
import de.bsommerfeld.cockpit.core.source.PullRequestSource;
import de.bsommerfeld.cockpit.core.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Offline {@link PullRequestSource} for TEST mode. Serves a fixed set of
 * generated PRs and applies the filter the way a hosting API would.
 */
@Singleton
public class TestPullRequestSource implements PullRequestSource {

    private static final Logger LOG = LoggerFactory.getLogger(TestPullRequestSource.class);

    static final int PULL_REQUEST_COUNT = 12;

    private final Clock clock;
    private final List<PullRequest> pullRequests;

    @Inject
    public TestPullRequestSource(Clock clock) {
        this(clock, TestDataGenerator.generatePullRequests(PULL_REQUEST_COUNT, clock.instant()));
    }

    TestPullRequestSource(Clock clock, List<PullRequest> pullRequests) {
        this.clock = clock;
        this.pullRequests = List.copyOf(pullRequests);
        LOG.warn("TEST MODE: serving {} generated pull requests", this.pullRequests.size());
    }

    @Override
    public PullRequest findById(String repository, String id) throws SourceException {
        return pullRequests.stream()
                .filter(pr -> pr.repository().equals(repository) && pr.id().equals(id))
                .findFirst()
                .orElseThrow(() -> SourceException.notFound(repository + "#" + id));
    }

    @Override
    public List<PullRequest> findByReviewer(String userId, PullRequestFilter filter) {
        return select(filter, pr -> pr.reviewers().stream()
                .anyMatch(r -> r.user() != null && r.user().id().equals(userId)));
    }

    @Override
    public List<PullRequest> listOpen(PullRequestFilter filter) {
        LOG.debug("[TEST] Listing open pull requests");
        return select(filter, pr -> true);
    }

    private List<PullRequest> select(PullRequestFilter filter, Predicate<PullRequest> extra) {
        Instant cutoff = clock.instant().minus(Duration.ofHours(filter.staleThresholdHours()));
        return pullRequests.stream()
                .filter(pr -> filter.allowsRepository(pr.repository()))
                .filter(pr -> !filter.staleOnly() || pr.updatedAt().isBefore(cutoff))
                .filter(extra)
                .limit(Math.max(filter.limit(), 0))
                .collect(Collectors.toList());
    }
}
