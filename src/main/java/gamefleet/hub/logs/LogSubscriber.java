package gamefleet.hub.logs;

/**
 * Receiving end of a log stream, typically a dashboard WebSocket.
 * Calls for one subscriber never overlap.
 */
public interface LogSubscriber {

    /**
     * Whether the subscriber can take more lines now. When false, delivery pauses
     * until {@link LogRelay#resume(StreamHandle)} is called.
     */
    default boolean ready() {
        return true;
    }

    void deliver(LogLine line);

    /**
     * The stream ended from the relay side, e.g. the upstream closed or the spoke was removed.
     */
    void closed(String reason);
}
