package de.bsommerfeld.cockpit.service.poll;

import java.time.Instant;

/**
 * Outcome of a single tick.
 *
 * @param data         fresh summary on success; on failure the last known
 *                     summary, or {@code null} if there never was one
 * @param errorMessage {@code null} on success
 */
public record PollResult<T>(PollDomain domain, T data, Instant timestamp, boolean success, String errorMessage) {

    public static <T> PollResult<T> success(PollDomain domain, T data, Instant timestamp) {
        return new PollResult<>(domain, data, timestamp, true, null);
    }

    public static <T> PollResult<T> failure(PollDomain domain, T lastKnown, Instant timestamp, String message) {
        return new PollResult<>(domain, lastKnown, timestamp, false, message);
    }
}
