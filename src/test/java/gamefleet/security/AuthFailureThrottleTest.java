package gamefleet.security;

import gamefleet.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class AuthFailureThrottleTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));

    @Test
    void blocksAfterMaxFailuresWithinWindow() {
        AuthFailureThrottle throttle = new AuthFailureThrottle(3, Duration.ofMinutes(1), 10, clock);
        assertEquals(1, throttle.recordFailure("1.2.3.4"));
        assertEquals(2, throttle.recordFailure("1.2.3.4"));
        assertFalse(throttle.isBlocked("1.2.3.4"));
        throttle.recordFailure("1.2.3.4");

        assertTrue(throttle.isBlocked("1.2.3.4"));
        assertFalse(throttle.isBlocked("5.6.7.8"));
    }

    @Test
    void windowExpiryUnblocks() {
        AuthFailureThrottle throttle = new AuthFailureThrottle(1, Duration.ofMinutes(1), 10, clock);
        throttle.recordFailure("1.2.3.4");
        assertTrue(throttle.isBlocked("1.2.3.4"));

        clock.advance(Duration.ofSeconds(61));
        assertFalse(throttle.isBlocked("1.2.3.4"));
        assertEquals(1, throttle.recordFailure("1.2.3.4"));
    }

    @Test
    void resetClearsTheOrigin() {
        AuthFailureThrottle throttle = new AuthFailureThrottle(1, Duration.ofMinutes(1), 10, clock);
        throttle.recordFailure("1.2.3.4");
        throttle.reset("1.2.3.4");
        assertFalse(throttle.isBlocked("1.2.3.4"));
    }

    @Test
    void tableStaysWithinCapacity() {
        AuthFailureThrottle throttle = new AuthFailureThrottle(5, Duration.ofMinutes(10), 3, clock);
        for (int i = 0; i < 10; i++) {
            clock.advance(Duration.ofSeconds(1));
            throttle.recordFailure("10.0.0." + i);
        }
        assertEquals(3, throttle.size());
    }
}
