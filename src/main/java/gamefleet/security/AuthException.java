package gamefleet.security;

/**
 * Thrown when the auth gate rejects a request.
 * Never retried automatically.
 */
public class AuthException extends RuntimeException {

    private final AuthFailure failure;

    public AuthException(AuthFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public AuthFailure failure() {
        return failure;
    }
}
