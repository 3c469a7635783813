package gamefleet.hub.logs;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Shared upstream for one (spoke, instance) pair with a replay ring and its subscribers.
 */
final class LogChannel {

    record Key(String spokeId, String instance) {
    }

    private final Key key;
    private final int replaySize;
    private final Deque<LogLine> replay = new ArrayDeque<>();
    private final List<SubscriberStream> streams = new ArrayList<>();

    private LogUpstream upstream;
    private boolean upstreamRequested;
    private boolean closed;

    LogChannel(Key key, int replaySize) {
        this.key = key;
        this.replaySize = replaySize;
    }

    Key key() {
        return key;
    }

    /**
     * Add a subscriber; it receives the replay ring before any live line.
     *
     * @return the stream, or null when the channel is already closed
     */
    synchronized SubscriberStream attach(LogSubscriber subscriber, int bufferSize, Consumer<SubscriberStream> scheduler) {
        if (closed) {
            return null;
        }
        SubscriberStream stream = new SubscriberStream(subscriber, Math.max(bufferSize, replaySize));
        for (LogLine line : replay) {
            if (stream.offer(line)) {
                scheduler.accept(stream);
            }
        }
        streams.add(stream);
        return stream;
    }

    /**
     * @return true when this was the last subscriber and the channel is now closed
     */
    synchronized boolean detach(SubscriberStream stream) {
        if (!streams.remove(stream)) {
            return false;
        }
        stream.close();
        if (streams.isEmpty() && !closed) {
            closed = true;
            return true;
        }
        return false;
    }

    /**
     * @return true exactly once, for the caller that must open the upstream
     */
    synchronized boolean claimUpstream() {
        if (closed || upstreamRequested) {
            return false;
        }
        upstreamRequested = true;
        return true;
    }

    /**
     * @return false when the channel closed while connecting; the caller closes the upstream
     */
    synchronized boolean upstreamOpened(LogUpstream opened) {
        if (closed) {
            return false;
        }
        this.upstream = opened;
        return true;
    }

    synchronized void append(LogLine line, Consumer<SubscriberStream> scheduler) {
        if (closed) {
            return;
        }
        replay.addLast(line);
        while (replay.size() > replaySize) {
            replay.pollFirst();
        }
        for (SubscriberStream stream : streams) {
            if (stream.offer(line)) {
                scheduler.accept(stream);
            }
        }
    }

    /**
     * Close the channel and every stream.
     *
     * @return the streams that were still open, so the caller can notify them outside the lock
     */
    synchronized List<SubscriberStream> closeAll() {
        closed = true;
        List<SubscriberStream> open = new ArrayList<>();
        for (SubscriberStream stream : streams) {
            if (stream.close()) {
                open.add(stream);
            }
        }
        streams.clear();
        return open;
    }

    synchronized LogUpstream takeUpstream() {
        LogUpstream current = upstream;
        upstream = null;
        return current;
    }

    synchronized int subscriberCount() {
        return streams.size();
    }

    synchronized boolean isClosed() {
        return closed;
    }
}
