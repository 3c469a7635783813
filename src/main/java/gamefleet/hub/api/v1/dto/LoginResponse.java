package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.service.AccountService;

import java.time.Instant;

/**
 * Response DTO carrying a dashboard session token.
 */
public record LoginResponse(
        @JsonProperty("accessToken") String accessToken,
        @JsonProperty("expiresAt") Instant expiresAt,
        @JsonProperty("role") String role) {

    public static LoginResponse from(AccountService.LoginResult result) {
        return new LoginResponse(result.accessToken(), result.expiresAt(), result.role().name());
    }
}
