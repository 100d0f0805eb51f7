package de.bsommerfeld.cockpit.service.search;

public enum SearchResultType {

    TICKET("Ticket"),
    PULL_REQUEST("PR"),
    INCIDENT("Incident"),
    DOCUMENT("Document");

    private final String label;

    SearchResultType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
