package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.registry.RegistrationResult;

public record RegisterSpokeResponse(
        @JsonProperty("spokeId") String spokeId,
        @JsonProperty("created") boolean created) {

    public static RegisterSpokeResponse from(RegistrationResult result) {
        return new RegisterSpokeResponse(result.spokeId(), result.created());
    }
}
