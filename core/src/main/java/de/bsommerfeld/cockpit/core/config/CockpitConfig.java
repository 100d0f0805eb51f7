package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root of {@code config.toml}. Each section maps to one nested POJO; missing
 * sections and keys fall back to the field defaults.
 */
public class CockpitConfig {

    @JsonProperty("debug-mode")
    private boolean debugMode = false;

    @JsonProperty("cache")
    private CacheConfig cache = new CacheConfig();

    @JsonProperty("poller")
    private PollerConfig poller = new PollerConfig();

    @JsonProperty("pull-requests")
    private PullRequestConfig pullRequests = new PullRequestConfig();

    @JsonProperty("incidents")
    private IncidentConfig incidents = new IncidentConfig();

    @JsonProperty("search")
    private SearchConfig search = new SearchConfig();

    @JsonProperty("events")
    private EventConfig events = new EventConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public PollerConfig getPoller() {
        return poller;
    }

    public PullRequestConfig getPullRequests() {
        return pullRequests;
    }

    public IncidentConfig getIncidents() {
        return incidents;
    }

    public SearchConfig getSearch() {
        return search;
    }

    public EventConfig getEvents() {
        return events;
    }
}
