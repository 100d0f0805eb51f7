package de.bsommerfeld.cockpit.core.alert;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AlertLevelTest {

    @Test
    void compute_shouldFollowRuleOrder() {
        assertEquals(AlertLevel.RED, AlertLevel.compute(1, 0, 0));
        assertEquals(AlertLevel.AMBER, AlertLevel.compute(0, 1, 0));
        assertEquals(AlertLevel.GREEN, AlertLevel.compute(0, 0, 0));
        assertEquals(AlertLevel.NEUTRAL, AlertLevel.compute(0, 0, 3));
    }

    @Test
    void compute_shouldLetIncidentsWinOverStaleItems() {
        assertEquals(AlertLevel.RED, AlertLevel.compute(2, 5, 7));
        assertEquals(AlertLevel.AMBER, AlertLevel.compute(0, 5, 7));
    }

    @Test
    void ordering_shouldBeStrict() {
        assertTrue(AlertLevel.RED.compareTo(AlertLevel.AMBER) > 0);
        assertTrue(AlertLevel.AMBER.compareTo(AlertLevel.GREEN) > 0);
        assertTrue(AlertLevel.GREEN.compareTo(AlertLevel.NEUTRAL) > 0);
    }

    @Test
    void combine_shouldPickMoreSevereLevel() {
        assertEquals(AlertLevel.RED, AlertLevel.GREEN.combine(AlertLevel.RED));
        assertEquals(AlertLevel.AMBER, AlertLevel.AMBER.combine(AlertLevel.NEUTRAL));
        assertEquals(AlertLevel.GREEN, AlertLevel.GREEN.combine(AlertLevel.GREEN));
    }

    @Test
    void transition_shouldFlagEnteringRed() {
        AlertTransition toRed = AlertTransition.between(AlertLevel.GREEN, AlertLevel.RED, "incident", Instant.EPOCH);
        AlertTransition leavingRed = AlertTransition.between(AlertLevel.RED, AlertLevel.AMBER, "resolved",
                Instant.EPOCH);

        assertTrue(toRed.shouldNotify());
        assertFalse(leavingRed.shouldNotify());
    }

    @Test
    void transition_shouldRejectSameLevel() {
        assertThrows(IllegalArgumentException.class,
                () -> AlertTransition.between(AlertLevel.GREEN, AlertLevel.GREEN, "noop", Instant.EPOCH));
    }
}
