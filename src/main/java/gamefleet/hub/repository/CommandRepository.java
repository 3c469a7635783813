package gamefleet.hub.repository;

import gamefleet.hub.model.Command;
import gamefleet.hub.model.CommandState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for command history.
 */
public interface CommandRepository {

    /**
     * Insert a newly issued command.
     *
     * @param command the command, normally in QUEUED state
     */
    void insert(Command command);

    /**
     * Find a command by ID.
     */
    Optional<Command> findById(String commandId);

    /**
     * Most recent commands of a spoke, newest first.
     *
     * @param spokeId the spoke ID
     * @param limit   maximum number of rows
     */
    List<Command> findBySpoke(String spokeId, int limit);

    /**
     * Commands of a spoke that have not reached a terminal state, oldest first.
     */
    List<Command> findActiveBySpoke(String spokeId);

    /**
     * Move a command to {@code next} only if its stored state may advance to it.
     *
     * @return true if the row was updated
     */
    boolean advance(String commandId, CommandState next, String detail, Instant at);
}
