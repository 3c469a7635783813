package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for dashboard login.
 * POST /api/v1/auth/login
 */
public record LoginRequest(
        @JsonProperty("username") String username,
        @JsonProperty("password") String password) {

    @Override
    public String toString() {
        return "LoginRequest{username='" + username + "'}";
    }
}
