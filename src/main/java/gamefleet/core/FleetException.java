package gamefleet.core;

/**
 * Domain failure carrying a distinguishable {@link ErrorKind}.
 */
public class FleetException extends RuntimeException {

    private final ErrorKind kind;

    public FleetException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public FleetException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public static FleetException notFound(String what, String id) {
        return new FleetException(ErrorKind.NOT_FOUND, what + " not found: " + id);
    }

    public static FleetException invalid(String message) {
        return new FleetException(ErrorKind.INVALID_REQUEST, message);
    }

    public static FleetException unreachable(String message) {
        return new FleetException(ErrorKind.SPOKE_UNREACHABLE, message);
    }

    public static FleetException storage(String message, Throwable cause) {
        return new FleetException(ErrorKind.INTERNAL_FAULT, message, cause);
    }
}
