package gamefleet.security;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts authentication failures per origin and blocks origins that fail too
 * often inside a sliding window. Counters expire with the window and the table
 * is capped, oldest entries evicted first.
 */
public final class AuthFailureThrottle {

    private final int maxFailures;
    private final Duration window;
    private final int capacity;
    private final Clock clock;

    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    private record Counter(int failures, Instant windowStart, Instant lastFailure) {
    }

    public AuthFailureThrottle(int maxFailures, Duration window, int capacity, Clock clock) {
        if (maxFailures < 1) {
            throw new IllegalArgumentException("maxFailures must be positive");
        }
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.maxFailures = maxFailures;
        this.window = window;
        this.capacity = capacity;
        this.clock = clock;
    }

    public boolean isBlocked(String origin) {
        Counter counter = counters.get(key(origin));
        if (counter == null) {
            return false;
        }
        if (expired(counter, clock.instant())) {
            counters.remove(key(origin), counter);
            return false;
        }
        return counter.failures() >= maxFailures;
    }

    /**
     * Record a failure.
     *
     * @return failures counted for the origin in the current window
     */
    public int recordFailure(String origin) {
        Instant now = clock.instant();
        Counter updated = counters.compute(key(origin), (k, existing) -> {
            if (existing == null || expired(existing, now)) {
                return new Counter(1, now, now);
            }
            return new Counter(existing.failures() + 1, existing.windowStart(), now);
        });
        if (counters.size() > capacity) {
            evict(now);
        }
        return updated.failures();
    }

    public void reset(String origin) {
        counters.remove(key(origin));
    }

    public int size() {
        return counters.size();
    }

    private void evict(Instant now) {
        counters.entrySet().removeIf(e -> expired(e.getValue(), now));
        while (counters.size() > capacity) {
            counters.entrySet().stream()
                    .min(Comparator.comparing(e -> e.getValue().lastFailure()))
                    .ifPresent(oldest -> counters.remove(oldest.getKey(), oldest.getValue()));
        }
    }

    private boolean expired(Counter counter, Instant now) {
        return !counter.windowStart().plus(window).isAfter(now);
    }

    private static String key(String origin) {
        return origin == null ? "unknown" : origin;
    }
}
