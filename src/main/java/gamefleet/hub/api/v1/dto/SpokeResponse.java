package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.model.SpokeMetrics;

import java.time.Instant;

/**
 * Response DTO for a spoke. Never carries key material.
 * GET /api/v1/spokes, GET /api/v1/spokes/{id}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SpokeResponse(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("address") String address,
        @JsonProperty("status") String status,
        @JsonProperty("allowedSourceIp") String allowedSourceIp,
        @JsonProperty("lastSeen") Instant lastSeen,
        @JsonProperty("consecutiveFailures") int consecutiveFailures,
        @JsonProperty("registeredAt") Instant registeredAt,
        @JsonProperty("metrics") SpokeMetrics metrics) {

    public static SpokeResponse from(Spoke spoke) {
        return new SpokeResponse(
                spoke.id(),
                spoke.name(),
                spoke.address(),
                spoke.status().name(),
                spoke.allowedSourceIp(),
                spoke.lastSeen(),
                spoke.consecutiveFailures(),
                spoke.registeredAt(),
                spoke.lastMetrics());
    }
}
