package gamefleet.core;

/**
 * Non-auth failure categories, each with the HTTP status it surfaces as.
 */
public enum ErrorKind {
    /** Unknown spoke, command or user */
    NOT_FOUND(404),
    /** Network failure or timeout talking to a spoke, or spoke not in a dispatchable state */
    SPOKE_UNREACHABLE(503),
    /** Request clashes with existing state */
    CONFLICT(409),
    /** Malformed or semantically invalid request */
    INVALID_REQUEST(400),
    /** Registry or storage failure */
    INTERNAL_FAULT(500);

    private final int httpStatus;

    ErrorKind(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public String code() {
        return name().toLowerCase();
    }
}
