package de.bsommerfeld.cockpit.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Selects which source implementations the composition root wires in.
 * {@link #TEST} swaps every upstream source for an in-memory one seeded with
 * generated data, so the cockpit runs without credentials or network.
 */
public enum ApplicationMode {

    PROD,
    TEST;

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationMode.class);

    /**
     * Reads {@code -Dapp.mode}, then {@code APP_MODE}. Defaults to
     * {@link #PROD}.
     */
    public static ApplicationMode get() {
        return resolve(System.getProperty("app.mode"), System.getenv("APP_MODE"));
    }

    static ApplicationMode resolve(String property, String environment) {
        String raw = property != null && !property.isBlank() ? property : environment;
        if (raw == null || raw.isBlank())
            return PROD;

        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            LOG.warn("Unknown application mode '{}', falling back to PROD", raw);
            return PROD;
        }
    }

    public boolean isTest() {
        return this == TEST;
    }
}
