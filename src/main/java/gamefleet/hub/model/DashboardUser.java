package gamefleet.hub.model;

import gamefleet.security.Role;

import java.time.Instant;

/**
 * Dashboard account. The password is only ever held as a hash.
 */
public record DashboardUser(
        String username,
        String passwordHash,
        Role role,
        Instant createdAt,
        Instant passwordChangedAt) {
}
