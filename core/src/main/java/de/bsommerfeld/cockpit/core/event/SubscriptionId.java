package de.bsommerfeld.cockpit.core.event;

/**
 * Opaque handle returned by {@link ApplicationEventBus#subscribe}. Values are
 * unique per bus and increase monotonically in subscription order.
 */
public record SubscriptionId(long value) implements Comparable<SubscriptionId> {

    @Override
    public int compareTo(SubscriptionId other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return "subscription#" + value;
    }
}
