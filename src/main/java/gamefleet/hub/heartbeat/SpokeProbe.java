package gamefleet.hub.heartbeat;

import gamefleet.hub.client.SpokeCallException;
import gamefleet.hub.client.SpokeClient;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.Spoke;
import gamefleet.protocol.StatusReport;

import java.time.Clock;
import java.time.Duration;

/**
 * One liveness check: a signed status call turned into a {@link HeartbeatSample}.
 */
public final class SpokeProbe {

    private final SpokeClient client;
    private final Duration timeout;
    private final Clock clock;

    public SpokeProbe(SpokeClient client, Duration timeout, Clock clock) {
        this.client = client;
        this.timeout = timeout;
        this.clock = clock;
    }

    public HeartbeatSample probe(Spoke spoke) {
        try {
            StatusReport report = client.status(spoke, timeout);
            return HeartbeatSample.success(spoke.id(), clock.instant(), report.toMetrics());
        } catch (SpokeCallException e) {
            String reason = e.reason() == SpokeCallException.Reason.REJECTED
                    ? "HTTP " + e.statusCode() + ": " + e.getMessage()
                    : e.reason().name().toLowerCase() + ": " + e.getMessage();
            return HeartbeatSample.failure(spoke.id(), clock.instant(), reason);
        }
    }
}
