package gamefleet.hub.client;

import gamefleet.hub.model.Command;
import gamefleet.hub.model.Spoke;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.StatusReport;

import java.time.Duration;

/**
 * Blocking, signed calls from the hub to a spoke agent.
 * Every call is bounded by the given timeout.
 */
public interface SpokeClient {

    StatusReport status(Spoke spoke, Duration timeout) throws SpokeCallException;

    /**
     * Hand a command to the agent. A reply means the agent accepted it for execution.
     */
    CommandReport sendCommand(Spoke spoke, Command command, Duration timeout) throws SpokeCallException;

    CommandReport commandStatus(Spoke spoke, String commandId, Duration timeout) throws SpokeCallException;
}
