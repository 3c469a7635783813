package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.registry.RegistrationRequest;

/**
 * Request DTO for spoke registration.
 * POST /api/v1/spokes and POST /internal/v1/provision/spokes
 */
public record RegisterSpokeRequest(
        @JsonProperty("name") String name,
        @JsonProperty("address") String address,
        @JsonProperty("apiKey") String apiKey,
        @JsonProperty("allowedSourceIp") String allowedSourceIp) {

    public RegistrationRequest toRegistration() {
        return new RegistrationRequest(name, address, apiKey, allowedSourceIp);
    }

    @Override
    public String toString() {
        return "RegisterSpokeRequest{name='" + name + "', address='" + address + "'}";
    }
}
