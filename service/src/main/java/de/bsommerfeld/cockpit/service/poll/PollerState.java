package de.bsommerfeld.cockpit.service.poll;

import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.alert.AlertStatus;

public record PollerState(
        boolean running,
        DomainState pullRequests,
        DomainState incidents,
        AlertLevel alertLevel,
        AlertStatus alertStatus) {

    public DomainState domain(PollDomain domain) {
        return domain == PollDomain.PULL_REQUESTS ? pullRequests : incidents;
    }
}
