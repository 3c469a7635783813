package gamefleet.hub.client;

/**
 * A call to a spoke agent did not produce a successful reply.
 */
public class SpokeCallException extends Exception {

    public enum Reason {
        /** No reply within the call timeout */
        TIMEOUT,
        /** Connection refused, reset or otherwise broken */
        CONNECTION,
        /** The agent answered with a non-2xx status */
        REJECTED
    }

    private final Reason reason;
    private final int statusCode;

    public SpokeCallException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = 0;
    }

    public SpokeCallException(int statusCode, String message) {
        super(message);
        this.reason = Reason.REJECTED;
        this.statusCode = statusCode;
    }

    public Reason reason() {
        return reason;
    }

    /** HTTP status for REJECTED, otherwise 0. */
    public int statusCode() {
        return statusCode;
    }
}
