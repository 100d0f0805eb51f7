package de.bsommerfeld.cockpit.core.source;

import java.util.List;

/**
 * Narrowing applied by a {@link PullRequestSource}.
 *
 * @param repositories allow-list of repository slugs, empty means all
 * @param staleOnly    only return PRs idle longer than
 *                     {@code staleThresholdHours}
 * @param limit        maximum number of PRs returned
 */
public record PullRequestFilter(List<String> repositories, boolean staleOnly, long staleThresholdHours, int limit) {

    public static final int DEFAULT_LIMIT = 20;
    public static final long DEFAULT_STALE_THRESHOLD_HOURS = 48;

    public PullRequestFilter {
        repositories = repositories == null ? List.of() : List.copyOf(repositories);
    }

    public static PullRequestFilter defaults() {
        return new PullRequestFilter(List.of(), false, DEFAULT_STALE_THRESHOLD_HOURS, DEFAULT_LIMIT);
    }

    public PullRequestFilter withRepositories(List<String> repositories) {
        return new PullRequestFilter(repositories, staleOnly, staleThresholdHours, limit);
    }

    public PullRequestFilter withStaleOnly(long thresholdHours) {
        return new PullRequestFilter(repositories, true, thresholdHours, limit);
    }

    public PullRequestFilter withLimit(int limit) {
        return new PullRequestFilter(repositories, staleOnly, staleThresholdHours, limit);
    }

    public boolean allowsRepository(String repository) {
        return repositories.isEmpty() || repositories.contains(repository);
    }
}
