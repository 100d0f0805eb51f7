package de.bsommerfeld.cockpit.core.event;

/**
 * Callback registered on the {@link ApplicationEventBus}. Invoked synchronously
 * on the publishing thread.
 */
@FunctionalInterface
public interface EventHandler {

    void onEvent(CockpitEvent event);
}
