package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.TransitionEvent;

import java.time.Instant;

public record TransitionResponse(
        @JsonProperty("spokeId") String spokeId,
        @JsonProperty("spokeName") String spokeName,
        @JsonProperty("from") String from,
        @JsonProperty("to") String to,
        @JsonProperty("timestamp") Instant timestamp) {

    public static TransitionResponse from(TransitionEvent event) {
        return new TransitionResponse(event.spokeId(), event.spokeName(),
                event.from().name(), event.to().name(), event.timestamp());
    }
}
