package gamefleet.security;

/**
 * Dashboard user role. Ordered from least to most privileged.
 */
public enum Role {
    /** Read-only access to fleet state and logs */
    VIEWER,
    /** May issue lifecycle commands (start/stop/restart) */
    OPERATOR,
    /** Full control, including registration, updates and credentials */
    ADMIN;

    public boolean atLeast(Role other) {
        return this.ordinal() >= other.ordinal();
    }
}
