package gamefleet.spoke.host;

import gamefleet.protocol.TelemetryReport;

import java.util.List;

/**
 * What the agent reports about its host.
 */
public interface HostProbe {

    /** Names of the running tmux sessions, one per started game-server instance. */
    List<String> sessions();

    TelemetryReport telemetry();
}
