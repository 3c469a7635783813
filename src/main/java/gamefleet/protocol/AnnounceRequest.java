package gamefleet.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sent by a spoke agent to the hub when it starts.
 */
public record AnnounceRequest(
        @JsonProperty("version") String version,
        @JsonProperty("port") int port) {
}
