package gamefleet.hub.logs;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Bounded buffer between a channel and one subscriber.
 * Overflow drops the oldest line and is reported as a gap before the next delivery.
 */
final class SubscriberStream {

    private final LogSubscriber subscriber;
    private final int capacity;
    private final Deque<LogLine> buffer = new ArrayDeque<>();

    private long dropped;
    private long totalDropped;
    private boolean scheduled;
    private boolean closed;

    SubscriberStream(LogSubscriber subscriber, int capacity) {
        this.subscriber = subscriber;
        this.capacity = capacity;
    }

    LogSubscriber subscriber() {
        return subscriber;
    }

    /**
     * @return true when the caller must schedule a drain
     */
    synchronized boolean offer(LogLine line) {
        if (closed) {
            return false;
        }
        if (buffer.size() >= capacity) {
            buffer.pollFirst();
            dropped++;
            totalDropped++;
        }
        buffer.addLast(line);
        return markScheduled();
    }

    /**
     * @return true when the caller must schedule a drain
     */
    synchronized boolean resume() {
        if (closed || (buffer.isEmpty() && dropped == 0)) {
            return false;
        }
        return markScheduled();
    }

    private boolean markScheduled() {
        if (scheduled) {
            return false;
        }
        scheduled = true;
        return true;
    }

    /**
     * Deliver up to {@code max} lines.
     *
     * @return true when lines remain and the caller must schedule another drain
     */
    boolean drain(int max) {
        for (int i = 0; i < max; i++) {
            LogLine next;
            synchronized (this) {
                if (closed || !subscriber.ready()) {
                    scheduled = false;
                    return false;
                }
                if (dropped > 0) {
                    next = LogLine.gap(dropped);
                    dropped = 0;
                } else {
                    next = buffer.pollFirst();
                }
                if (next == null) {
                    scheduled = false;
                    return false;
                }
            }
            subscriber.deliver(next);
        }
        return true;
    }

    /**
     * @return false when already closed
     */
    synchronized boolean close() {
        if (closed) {
            return false;
        }
        closed = true;
        buffer.clear();
        return true;
    }

    synchronized int buffered() {
        return buffer.size();
    }

    synchronized long totalDropped() {
        return totalDropped;
    }
}
