package de.bsommerfeld.cockpit.service.pr;

import de.bsommerfeld.cockpit.core.domain.PullRequest;

import java.util.List;

public record PrGroup(String label, List<PullRequest> pullRequests, int staleCount) {

    public PrGroup {
        pullRequests = List.copyOf(pullRequests);
    }
}
