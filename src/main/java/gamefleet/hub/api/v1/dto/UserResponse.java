package gamefleet.hub.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import gamefleet.hub.model.DashboardUser;

import java.time.Instant;

public record UserResponse(
        @JsonProperty("username") String username,
        @JsonProperty("role") String role,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("passwordChangedAt") Instant passwordChangedAt) {

    public static UserResponse from(DashboardUser user) {
        return new UserResponse(user.username(), user.role().name(), user.createdAt(), user.passwordChangedAt());
    }
}
