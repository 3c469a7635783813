package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for issuing a command.
 * POST /api/v1/spokes/{id}/commands
 */
public record DispatchCommandRequest(
        @JsonProperty("verb") String verb,
        @JsonProperty("targetInstance") String targetInstance,
        @JsonProperty("argument") String argument) {
}
