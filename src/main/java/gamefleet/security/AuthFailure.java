package gamefleet.security;

/**
 * Reasons the auth gate rejects a request.
 */
public enum AuthFailure {
    /** Missing, malformed, expired or revoked dashboard credentials */
    UNAUTHENTICATED(401),
    /** Credentials present but wrong, or not allowed for the operation */
    UNAUTHORIZED(403),
    /** Valid spoke credentials presented from a non-allowlisted address */
    FORBIDDEN_SOURCE_IP(403),
    /** Too many recent failures from the same origin */
    THROTTLED(429);

    private final int httpStatus;

    AuthFailure(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return name().toLowerCase();
    }
}
