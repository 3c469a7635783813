package gamefleet.hub.logs;

/**
 * Open connection to a spoke's log tail.
 */
public interface LogUpstream {

    void close();
}
