package de.bsommerfeld.cockpit.core.domain;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a pull request as returned by the git-hosting source.
 *
 * @param id         provider id, unique within {@code repository}
 * @param repository repository slug the PR belongs to
 * @param reviewers  requested reviewers; never {@code null}
 * @param updatedAt  last activity; drives staleness
 */
public record PullRequest(
        String id,
        String repository,
        String title,
        String description,
        PrState state,
        User author,
        List<Reviewer> reviewers,
        String sourceBranch,
        String targetBranch,
        ChecksStatus checksStatus,
        Instant updatedAt,
        Instant createdAt,
        String url) {

    public PullRequest {
        reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
    }
}
