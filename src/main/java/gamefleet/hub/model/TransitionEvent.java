package gamefleet.hub.model;

import java.time.Instant;

/**
 * A spoke changed status. Emitted once per actual change.
 */
public record TransitionEvent(
        String spokeId,
        String spokeName,
        SpokeStatus from,
        SpokeStatus to,
        Instant timestamp) {
}
