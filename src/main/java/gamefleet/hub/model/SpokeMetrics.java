package gamefleet.hub.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Resource usage reported by a spoke agent.
 */
public record SpokeMetrics(
        @JsonProperty("cpu") double cpuPercent,
        @JsonProperty("ram") double ramPercent,
        @JsonProperty("disk") double diskPercent,
        @JsonProperty("sessions") List<String> sessions) {

    public SpokeMetrics {
        sessions = sessions == null ? List.of() : List.copyOf(sessions);
    }

    public static SpokeMetrics empty() {
        return new SpokeMetrics(0, 0, 0, List.of());
    }
}
