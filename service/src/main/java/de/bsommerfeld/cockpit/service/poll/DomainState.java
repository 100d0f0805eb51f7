package de.bsommerfeld.cockpit.service.poll;

import java.time.Instant;

/**
 * Point-in-time view of one domain's counters.
 *
 * @param lastPoll            end of the last tick, {@code null} before the
 *                            first one
 * @param pollCount           ticks run so far, failed ones included
 * @param consecutiveFailures failed ticks since the last success
 * @param lastError           message of the most recent failure, cleared on
 *                            success
 */
public record DomainState(
        PollDomain domain,
        DomainPhase phase,
        boolean enabled,
        Instant lastPoll,
        long pollCount,
        int consecutiveFailures,
        String lastError) {
}
