package de.bsommerfeld.cockpit.core.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApplicationModeTest {

    @Test
    void resolve_shouldDefaultToProd() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve(null, null));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("", " "));
    }

    @Test
    void resolve_shouldPreferSystemPropertyOverEnvironment() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve("test", "PROD"));
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("PROD", "TEST"));
    }

    @Test
    void resolve_shouldFallBackToEnvironment() {
        assertEquals(ApplicationMode.TEST, ApplicationMode.resolve(null, "TEST"));
    }

    @Test
    void resolve_shouldFallBackToProdForUnknownValue() {
        assertEquals(ApplicationMode.PROD, ApplicationMode.resolve("staging", null));
    }

    @Test
    void get_shouldResolveFromSystemProperty() {
        String original = System.getProperty("app.mode");
        try {
            System.setProperty("app.mode", "TEST");
            assertTrue(ApplicationMode.get().isTest());
        } finally {
            if (original != null)
                System.setProperty("app.mode", original);
            else
                System.clearProperty("app.mode");
        }
    }
}
