package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateUserRequest(
        @JsonProperty("username") String username,
        @JsonProperty("password") String password,
        @JsonProperty("role") String role) {

    @Override
    public String toString() {
        return "CreateUserRequest{username='" + username + "', role=" + role + "}";
    }
}
