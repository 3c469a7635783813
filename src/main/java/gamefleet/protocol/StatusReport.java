package gamefleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.SpokeMetrics;

import java.util.List;

/**
 * Body of {@code GET /v1/status} on a spoke agent.
 */
public record StatusReport(
        @JsonProperty("status") String status,
        @JsonProperty("sessions") List<String> sessions,
        @JsonProperty("metrics") TelemetryReport metrics) {

    public SpokeMetrics toMetrics() {
        TelemetryReport t = metrics != null ? metrics : new TelemetryReport(0, 0, 0);
        return new SpokeMetrics(t.cpu(), t.ram(), t.disk(), sessions);
    }
}
