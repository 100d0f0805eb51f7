package de.bsommerfeld.cockpit.service.poll;

/**
 * Independently scheduled polling domains.
 */
public enum PollDomain {

    PULL_REQUESTS("pr"),
    INCIDENTS("incident");

    private final String id;

    PollDomain(String id) {
        this.id = id;
    }

    /**
     * Short name used in events and thread names.
     */
    public String id() {
        return id;
    }
}
