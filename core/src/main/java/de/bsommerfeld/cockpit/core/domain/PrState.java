package de.bsommerfeld.cockpit.core.domain;

public enum PrState {
    OPEN("Open"),
    MERGED("Merged"),
    DECLINED("Declined"),
    DRAFT("Draft");

    private final String label;

    PrState(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
