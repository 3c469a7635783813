package gamefleet.hub.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Liveness status of a spoke, driven by the heartbeat monitor.
 */
public enum SpokeStatus {
    /** Registered, no successful heartbeat yet */
    PENDING,
    /** Last heartbeat succeeded */
    ONLINE,
    /** Missed N consecutive heartbeats */
    DEGRADED,
    /** Missed M consecutive heartbeats */
    OFFLINE;

    private Set<SpokeStatus> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(ONLINE);
            case ONLINE -> EnumSet.of(DEGRADED, OFFLINE);
            case DEGRADED -> EnumSet.of(ONLINE, OFFLINE);
            case OFFLINE -> EnumSet.of(ONLINE);
        };
    }

    public boolean canTransitionTo(SpokeStatus next) {
        return next != null && successors().contains(next);
    }

    /** Reachable enough to receive commands, depending on the degraded policy. */
    public boolean acceptsCommands(boolean allowDegraded) {
        return this == ONLINE || (allowDegraded && this == DEGRADED);
    }
}
