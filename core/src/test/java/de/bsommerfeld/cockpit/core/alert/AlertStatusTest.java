package de.bsommerfeld.cockpit.core.alert;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AlertStatusTest {

    @Test
    void level_shouldDeriveFromCounts() {
        assertEquals(AlertLevel.GREEN, AlertStatus.EMPTY.level());
        assertEquals(AlertLevel.NEUTRAL, AlertStatus.EMPTY.withPullRequests(2, 0).level());
        assertEquals(AlertLevel.AMBER, AlertStatus.EMPTY.withPullRequests(2, 1).level());
        assertEquals(AlertLevel.RED, AlertStatus.EMPTY.withPullRequests(2, 1).withIncidents(1).level());
    }

    @Test
    void tooltip_shouldPluralizeCounts() {
        AlertStatus status = AlertStatus.EMPTY.withPullRequests(2, 1).withIncidents(3);
        assertEquals("2 PRs waiting. 1 stale PR. 3 active incidents.", status.tooltip());
    }

    @Test
    void tooltip_shouldFallBackToMessageThenDefault() {
        assertEquals("All systems nominal.", AlertStatus.EMPTY.tooltip());
        assertEquals("Paused", AlertStatus.EMPTY.withMessage("Paused").tooltip());
    }
}
