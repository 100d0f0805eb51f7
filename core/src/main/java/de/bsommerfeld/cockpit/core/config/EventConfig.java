package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class EventConfig {

    /** Number of published events kept for diagnostics. */
    @JsonProperty("history-size")
    private int historySize = 100;

    public int getHistorySize() {
        return historySize;
    }

    public void setHistorySize(int historySize) {
        this.historySize = historySize;
    }
}
