package de.bsommerfeld.cockpit.core.event;

/**
 * Marker for everything that travels over the {@link ApplicationEventBus}.
 * Implementations are immutable records, so a single instance can be handed
 * to every subscriber without copying.
 */
public interface CockpitEvent {

    /**
     * Short type name used in log lines and diagnostics.
     */
    default String typeName() {
        return getClass().getSimpleName();
    }
}
