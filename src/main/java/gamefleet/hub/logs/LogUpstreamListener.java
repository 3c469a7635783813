package gamefleet.hub.logs;

/**
 * Callbacks from an upstream log connection. Lines arrive in spoke order.
 */
public interface LogUpstreamListener {

    void onLine(String line);

    /**
     * The connection failed or ended. Called at most once.
     */
    void onClosed(String reason);
}
