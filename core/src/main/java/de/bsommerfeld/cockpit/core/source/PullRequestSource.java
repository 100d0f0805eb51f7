package de.bsommerfeld.cockpit.core.source;

import de.bsommerfeld.cockpit.core.domain.PullRequest;

import java.util.List;

/**
 * Git-hosting capability consumed by the PR aggregator. Implementations own
 * transport, authentication and timeouts; they report every failure as a
 * {@link SourceException}.
 */
public interface PullRequestSource {

    /**
     * @throws SourceException with {@link SourceException.Kind#NOT_FOUND} if
     *                         the PR does not exist
     */
    PullRequest findById(String repository, String id) throws SourceException;

    /**
     * Returns open PRs on which {@code userId} is a requested reviewer.
     */
    List<PullRequest> findByReviewer(String userId, PullRequestFilter filter) throws SourceException;

    List<PullRequest> listOpen(PullRequestFilter filter) throws SourceException;
}
