package de.bsommerfeld.cockpit.core.domain;

public record Reviewer(User user, boolean approved) {
}
