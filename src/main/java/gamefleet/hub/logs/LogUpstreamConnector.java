package gamefleet.hub.logs;

import gamefleet.hub.model.Spoke;

/**
 * Opens upstream log connections. Must not block: connection failures are
 * reported through {@link LogUpstreamListener#onClosed(String)}.
 */
@FunctionalInterface
public interface LogUpstreamConnector {

    LogUpstream open(Spoke spoke, String instance, LogUpstreamListener listener);
}
