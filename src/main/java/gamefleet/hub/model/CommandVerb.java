package gamefleet.hub.model;

import java.util.Locale;

/**
 * Control action requested on a spoke's game-server instance.
 */
public enum CommandVerb {
    START,
    STOP,
    RESTART,
    UPDATE,
    /** Any other action the spoke agent allows, carried in the command argument */
    CUSTOM;

    /** Start, stop and restart change the running state of a process. */
    public boolean isDestructive() {
        return this == START || this == STOP || this == RESTART;
    }

    public static CommandVerb parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("verb is required");
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown verb: " + raw);
        }
    }
}
