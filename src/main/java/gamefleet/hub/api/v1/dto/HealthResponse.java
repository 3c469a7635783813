package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("spokes") Map<String, Integer> spokes) {

    public static HealthResponse healthy(String uptime, String version, Map<String, Integer> spokes) {
        return new HealthResponse("UP", "connected", uptime, version, spokes);
    }

    public static HealthResponse unhealthy(String reason) {
        return new HealthResponse("DOWN", reason, null, null, null);
    }
}
