package gamefleet.hub.model;

import java.time.Instant;

/**
 * Outcome of one heartbeat poll. Kept only in a bounded per-spoke ring.
 *
 * @param failureReason null when reachable
 */
public record HeartbeatSample(
        String spokeId,
        Instant timestamp,
        boolean reachable,
        SpokeMetrics metrics,
        String failureReason) {

    public static HeartbeatSample success(String spokeId, Instant at, SpokeMetrics metrics) {
        return new HeartbeatSample(spokeId, at, true, metrics, null);
    }

    public static HeartbeatSample failure(String spokeId, Instant at, String reason) {
        return new HeartbeatSample(spokeId, at, false, null, reason);
    }
}
