package gamefleet.hub.logs;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One subscription to a log channel. Closing it unsubscribes.
 */
public final class StreamHandle implements AutoCloseable {

    private final LogRelay relay;
    private final LogChannel channel;
    private final SubscriberStream stream;
    private final AtomicBoolean closed = new AtomicBoolean();

    StreamHandle(LogRelay relay, LogChannel channel, SubscriberStream stream) {
        this.relay = relay;
        this.channel = channel;
        this.stream = stream;
    }

    public String spokeId() {
        return channel.key().spokeId();
    }

    public String instance() {
        return channel.key().instance();
    }

    public boolean isClosed() {
        return closed.get() || channel.isClosed();
    }

    LogChannel channel() {
        return channel;
    }

    SubscriberStream stream() {
        return stream;
    }

    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    @Override
    public void close() {
        relay.unsubscribe(this);
    }
}
