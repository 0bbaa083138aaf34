package uk.co.speedyvan.realtime.core.reconnect;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import uk.co.speedyvan.realtime.core.support.ManualTaskScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconnectionControllerTest {

    private ManualTaskScheduler scheduler;
    private List<Integer> fired;
    private ReconnectionController controller;

    @BeforeEach
    void setUp() {
        scheduler = new ManualTaskScheduler();
        fired = new ArrayList<>();
        controller = new ReconnectionController(
                new ExponentialBackoff(Duration.ofMillis(1000), Duration.ofSeconds(60)), 3, scheduler, fired::add);
    }

    @Test
    void connectionLossSchedulesFirstAttemptAfterBaseDelay() {
        assertTrue(controller.onConnectionLost());

        assertEquals(List.of(Duration.ofMillis(1000)), scheduler.oneShotDelays());
        scheduler.advance(Duration.ofMillis(999));
        assertTrue(fired.isEmpty());
        scheduler.advance(Duration.ofMillis(1));
        assertEquals(List.of(1), fired);
    }

    @Test
    void repeatedLossSignalsDoNotStackAttempts() {
        controller.onConnectionLost();
        assertFalse(controller.onConnectionLost());

        assertEquals(1, scheduler.pendingOneShotCount());
        assertEquals(1, controller.attempts());
    }

    @Test
    void failedAttemptsBackOffUntilExhausted() {
        controller.onConnectionLost();
        for (int i = 0; i < 3; i++) {
            scheduler.advance(Duration.ofMinutes(1));
            assertTrue(controller.beginAttempt(fired.get(fired.size() - 1)));
            boolean scheduled = controller.attemptFailed();
            assertEquals(i < 2, scheduled);
        }

        assertEquals(List.of(1, 2, 3), fired);
        assertEquals(List.of(Duration.ofMillis(1000), Duration.ofMillis(2000), Duration.ofMillis(4000)),
                scheduler.oneShotDelays());
        assertTrue(controller.isExhausted());
        assertFalse(controller.onConnectionLost());
        assertEquals(0, scheduler.pendingOneShotCount());
    }

    @Test
    void resetCancelsPendingAttemptAndRestartsCounting() {
        controller.onConnectionLost();
        controller.reset();

        scheduler.advance(Duration.ofMinutes(1));
        assertTrue(fired.isEmpty());
        assertEquals(0, controller.attempts());

        controller.onConnectionLost();
        assertEquals(Duration.ofMillis(1000), controller.lastDelay());
    }

    @Test
    void staleAttemptIsRejected() {
        controller.onConnectionLost();
        controller.reset();

        assertFalse(controller.beginAttempt(1));
    }

    @Test
    void noAttemptIsScheduledWhileOneIsInFlight() {
        controller.onConnectionLost();
        scheduler.advance(Duration.ofSeconds(1));
        assertTrue(controller.beginAttempt(1));

        assertFalse(controller.onConnectionLost());
        assertFalse(controller.isAttemptPending());
    }

    @Test
    void attemptIsInFlightFromSchedulingUntilItsOutcome() {
        assertFalse(controller.isAttemptInFlight());

        controller.onConnectionLost();
        assertTrue(controller.isAttemptInFlight());
        scheduler.advance(Duration.ofSeconds(1));
        controller.beginAttempt(1);
        assertTrue(controller.isAttemptInFlight());

        controller.reset();
        assertFalse(controller.isAttemptInFlight());
    }

    @Test
    void completedAttemptKeepsTheCount() {
        controller.onConnectionLost();
        scheduler.advance(Duration.ofSeconds(1));
        controller.beginAttempt(1);

        controller.attemptCompleted();

        assertFalse(controller.isAttemptInFlight());
        assertEquals(1, controller.attempts());
        assertTrue(controller.onConnectionLost());
        assertEquals(Duration.ofMillis(2000), controller.lastDelay());
    }

    @Test
    void zeroMaxAttemptsIsImmediatelyExhausted() {
        ReconnectionController none = new ReconnectionController(
                new ExponentialBackoff(Duration.ofMillis(1000), Duration.ofSeconds(60)), 0, scheduler, fired::add);

        assertFalse(none.onConnectionLost());
        assertTrue(none.isExhausted());
    }
}
