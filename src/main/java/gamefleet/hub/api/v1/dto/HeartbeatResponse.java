package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.SpokeMetrics;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HeartbeatResponse(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("reachable") boolean reachable,
        @JsonProperty("metrics") SpokeMetrics metrics,
        @JsonProperty("failureReason") String failureReason) {

    public static HeartbeatResponse from(HeartbeatSample sample) {
        return new HeartbeatResponse(sample.timestamp(), sample.reachable(), sample.metrics(), sample.failureReason());
    }
}
