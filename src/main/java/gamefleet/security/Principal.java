package gamefleet.security;

import java.util.Objects;

/**
 * Authenticated caller of an API.
 *
 * @param name    username, or {@code spoke:<id>} for spoke-originated calls
 * @param role    effective role
 * @param tokenId id of the session token used, null for non-dashboard callers
 */
public record Principal(String name, Role role, String tokenId) {

    public Principal {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(role, "role");
    }

    public static Principal spoke(String spokeId) {
        return new Principal("spoke:" + spokeId, Role.VIEWER, null);
    }

    public static Principal provisioner() {
        return new Principal("provisioner", Role.ADMIN, null);
    }

    public boolean hasRole(Role required) {
        return role.atLeast(required);
    }
}
