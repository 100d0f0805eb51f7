package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Which repositories are aggregated and who "pending review" is computed for.
 */
public class PullRequestConfig {

    @JsonProperty("repositories")
    private List<String> repositories = new ArrayList<>();

    @JsonProperty("stale-threshold-hours")
    private long staleThresholdHours = 48;

    /** Reviewer identity; {@code null} disables pending-review counting. */
    @JsonProperty("user-id")
    private String userId;

    /**
     * Also count a review request when the reviewer's display name equals
     * {@code user-id}. Display names are not unique, so this can over-count.
     */
    @JsonProperty("match-reviewer-by-name")
    private boolean matchReviewerByName = true;

    @JsonProperty("fetch-limit")
    private int fetchLimit = 100;

    public List<String> getRepositories() {
        return repositories;
    }

    public void setRepositories(List<String> repositories) {
        this.repositories = repositories;
    }

    public long getStaleThresholdHours() {
        return staleThresholdHours;
    }

    public void setStaleThresholdHours(long staleThresholdHours) {
        this.staleThresholdHours = staleThresholdHours;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public boolean isMatchReviewerByName() {
        return matchReviewerByName;
    }

    public void setMatchReviewerByName(boolean matchReviewerByName) {
        this.matchReviewerByName = matchReviewerByName;
    }

    public int getFetchLimit() {
        return fetchLimit;
    }
}
