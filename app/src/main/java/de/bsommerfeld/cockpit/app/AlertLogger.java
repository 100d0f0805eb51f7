package de.bsommerfeld.cockpit.app;

import de.bsommerfeld.cockpit.core.alert.AlertLevel;
import de.bsommerfeld.cockpit.core.event.CockpitEvent;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.AlertLevelChanged;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.CacheInvalidated;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.ErrorOccurred;
import de.bsommerfeld.cockpit.core.event.CockpitEvents.IncidentsUpdated;
import de.bsommerfeld.cockpit.core.event.EventHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless stand-in for a tray icon: writes alert transitions, new incidents
 * and errors to the log.
 */
public class AlertLogger implements EventHandler {

    private static final Logger LOG = LoggerFactory.getLogger(AlertLogger.class);

    @Override
    public void onEvent(CockpitEvent event) {
        if (event instanceof AlertLevelChanged) {
            AlertLevelChanged changed = (AlertLevelChanged) event;
            if (changed.to() == AlertLevel.RED)
                LOG.warn("ALERT {} -> {}: {}", changed.from().displayName(), changed.to().displayName(),
                        changed.reason());
            else
                LOG.info("Alert level {} -> {}", changed.from().displayName(), changed.to().displayName());
        } else if (event instanceof IncidentsUpdated) {
            IncidentsUpdated updated = (IncidentsUpdated) event;
            if (!updated.newIncidentIds().isEmpty())
                LOG.warn("New incidents: {}", updated.newIncidentIds());
        } else if (event instanceof ErrorOccurred) {
            ErrorOccurred error = (ErrorOccurred) event;
            LOG.warn("{} error: {}", error.source(), error.message());
        } else if (event instanceof CacheInvalidated) {
            CacheInvalidated invalidated = (CacheInvalidated) event;
            LOG.info("Swept {} expired {} cache entries", invalidated.count(), invalidated.cacheType());
        }
    }
}
