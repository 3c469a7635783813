package gamefleet.hub.heartbeat;

import gamefleet.hub.model.SpokeStatus;

/**
 * Liveness rules applied to each heartbeat outcome.
 * Pure: the caller owns the spoke record and its lock.
 */
public final class HeartbeatStateMachine {

    private final int degradedAfter;
    private final int offlineAfter;

    /**
     * @param degradedAfter consecutive misses before an ONLINE spoke is DEGRADED
     * @param offlineAfter  consecutive misses before a spoke is OFFLINE, must exceed {@code degradedAfter}
     */
    public HeartbeatStateMachine(int degradedAfter, int offlineAfter) {
        if (degradedAfter < 1 || offlineAfter <= degradedAfter) {
            throw new IllegalArgumentException(
                    "thresholds must satisfy 1 <= degradedAfter < offlineAfter, got "
                            + degradedAfter + "/" + offlineAfter);
        }
        this.degradedAfter = degradedAfter;
        this.offlineAfter = offlineAfter;
    }

    /**
     * Result of folding one heartbeat into a spoke.
     *
     * @param status       status after the heartbeat
     * @param failures     consecutive failure count after the heartbeat
     * @param transitioned whether {@code status} differs from the previous one
     */
    public record Outcome(SpokeStatus status, int failures, boolean transitioned) {
    }

    public Outcome apply(SpokeStatus current, int failures, boolean reachable) {
        return reachable ? onSuccess(current) : onFailure(current, failures);
    }

    public Outcome onSuccess(SpokeStatus current) {
        return new Outcome(SpokeStatus.ONLINE, 0, current != SpokeStatus.ONLINE);
    }

    public Outcome onFailure(SpokeStatus current, int failures) {
        int count = failures + 1;
        SpokeStatus next = switch (current) {
            case PENDING -> SpokeStatus.PENDING;
            case OFFLINE -> SpokeStatus.OFFLINE;
            case ONLINE, DEGRADED -> {
                if (count >= offlineAfter) {
                    yield SpokeStatus.OFFLINE;
                }
                yield count >= degradedAfter ? SpokeStatus.DEGRADED : current;
            }
        };
        return new Outcome(next, count, next != current);
    }

    public int degradedAfter() {
        return degradedAfter;
    }

    public int offlineAfter() {
        return offlineAfter;
    }
}
