package gamefleet.hub.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Command lifecycle. Moves forward only:
 * QUEUED -> SENT -> ACKNOWLEDGED -> {SUCCEEDED | FAILED | TIMED_OUT}.
 */
public enum CommandState {
    /** Waiting behind an earlier command for the same spoke */
    QUEUED,
    /** Request sent, no acknowledgment yet */
    SENT,
    /** Spoke confirmed receipt and is executing */
    ACKNOWLEDGED,
    /** Action completed successfully */
    SUCCEEDED,
    /** Spoke reported an error, or the command was cancelled */
    FAILED,
    /** Spoke never answered within the deadline */
    TIMED_OUT;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == TIMED_OUT;
    }

    public boolean canAdvanceTo(CommandState next) {
        return switch (this) {
            case QUEUED -> next == SENT || next == FAILED;
            case SENT -> next == ACKNOWLEDGED || next == FAILED || next == TIMED_OUT;
            case ACKNOWLEDGED -> next.isTerminal();
            case SUCCEEDED, FAILED, TIMED_OUT -> false;
        };
    }

    /** States from which {@code target} may be entered. */
    public static Set<CommandState> predecessorsOf(CommandState target) {
        Set<CommandState> result = EnumSet.noneOf(CommandState.class);
        for (CommandState s : values()) {
            if (s.canAdvanceTo(target)) {
                result.add(s);
            }
        }
        return result;
    }
}
