package de.bsommerfeld.cockpit.core.domain;

/**
 * Account on one of the upstream trackers.
 *
 * @param id    stable account id
 * @param name  display name, not guaranteed unique
 * @param email may be {@code null}
 */
public record User(String id, String name, String email, String avatarUrl) {

    public User(String id, String name) {
        this(id, name, null, null);
    }
}
