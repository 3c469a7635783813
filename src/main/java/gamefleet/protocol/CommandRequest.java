package gamefleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /v1/commands}: run {@code ./<instance> <action>} on the spoke.
 */
public record CommandRequest(
        @JsonProperty("commandId") String commandId,
        @JsonProperty("instance") String instance,
        @JsonProperty("action") String action) {
}
