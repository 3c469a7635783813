package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ChangePasswordRequest(
        @JsonProperty("currentPassword") String currentPassword,
        @JsonProperty("newPassword") String newPassword) {

    @Override
    public String toString() {
        return "ChangePasswordRequest{}";
    }
}
