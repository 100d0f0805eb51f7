package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class SearchConfig {

    @JsonProperty("default-limit")
    private int defaultLimit = 10;

    /**
     * Base URL of the ticket tracker; ticket results link to
     * {@code <url>/browse/<key>} when set.
     */
    @JsonProperty("ticket-browse-url")
    private String ticketBrowseUrl;

    public int getDefaultLimit() {
        return defaultLimit;
    }

    public String getTicketBrowseUrl() {
        return ticketBrowseUrl;
    }

    public void setTicketBrowseUrl(String ticketBrowseUrl) {
        this.ticketBrowseUrl = ticketBrowseUrl;
    }
}
