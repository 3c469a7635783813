package gamefleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Resource usage in percent, as returned by {@code GET /v1/telemetry}.
 */
public record TelemetryReport(
        @JsonProperty("cpu") double cpu,
        @JsonProperty("ram") double ram,
        @JsonProperty("disk") double disk) {
}
