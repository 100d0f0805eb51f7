package de.bsommerfeld.cockpit.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.cockpit.core.domain.Severity;

import java.util.ArrayList;
import java.util.List;

public class IncidentConfig {

    /** Service allow-list for alertable incidents; empty means all services. */
    @JsonProperty("services")
    private List<String> services = new ArrayList<>();

    @JsonProperty("alert-on-severity")
    private Severity alertOnSeverity = Severity.HIGH;

    public List<String> getServices() {
        return services;
    }

    public void setServices(List<String> services) {
        this.services = services;
    }

    public Severity getAlertOnSeverity() {
        return alertOnSeverity;
    }

    public void setAlertOnSeverity(Severity alertOnSeverity) {
        this.alertOnSeverity = alertOnSeverity;
    }
}
