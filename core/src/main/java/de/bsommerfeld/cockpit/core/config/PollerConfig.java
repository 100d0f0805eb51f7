package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Background polling schedule. Every domain ticks on its own interval; after a
 * failed tick the next delay doubles per consecutive failure, capped at
 * {@code max-backoff-seconds}.
 */
public class PollerConfig {

    @JsonProperty("pr-poll-interval-seconds")
    private long prPollIntervalSeconds = 120;

    @JsonProperty("incident-poll-interval-seconds")
    private long incidentPollIntervalSeconds = 30;

    @JsonProperty("pr-polling-enabled")
    private boolean prPollingEnabled = true;

    @JsonProperty("incident-polling-enabled")
    private boolean incidentPollingEnabled = true;

    @JsonProperty("initial-delay-seconds")
    private long initialDelaySeconds = 0;

    /** Upper bound for the failure backoff; 0 keeps the plain interval. */
    @JsonProperty("max-backoff-seconds")
    private long maxBackoffSeconds = 600;

    @JsonIgnore
    public Duration getPrPollInterval() {
        return Duration.ofSeconds(prPollIntervalSeconds);
    }

    public void setPrPollIntervalSeconds(long prPollIntervalSeconds) {
        this.prPollIntervalSeconds = prPollIntervalSeconds;
    }

    @JsonIgnore
    public Duration getIncidentPollInterval() {
        return Duration.ofSeconds(incidentPollIntervalSeconds);
    }

    public void setIncidentPollIntervalSeconds(long incidentPollIntervalSeconds) {
        this.incidentPollIntervalSeconds = incidentPollIntervalSeconds;
    }

    public boolean isPrPollingEnabled() {
        return prPollingEnabled;
    }

    public void setPrPollingEnabled(boolean prPollingEnabled) {
        this.prPollingEnabled = prPollingEnabled;
    }

    public boolean isIncidentPollingEnabled() {
        return incidentPollingEnabled;
    }

    public void setIncidentPollingEnabled(boolean incidentPollingEnabled) {
        this.incidentPollingEnabled = incidentPollingEnabled;
    }

    @JsonIgnore
    public Duration getInitialDelay() {
        return Duration.ofSeconds(initialDelaySeconds);
    }

    @JsonIgnore
    public Duration getMaxBackoff() {
        return Duration.ofSeconds(maxBackoffSeconds);
    }

    public void setMaxBackoffSeconds(long maxBackoffSeconds) {
        this.maxBackoffSeconds = maxBackoffSeconds;
    }
}
