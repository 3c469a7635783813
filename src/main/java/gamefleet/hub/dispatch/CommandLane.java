package gamefleet.hub.dispatch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * FIFO of queued commands for one spoke. At most one command is in SENT at a time.
 */
final class CommandLane {

    private final Deque<String> pending = new ArrayDeque<>();
    private boolean busy;

    synchronized void enqueue(String commandId) {
        pending.addLast(commandId);
    }

    /**
     * @return the next command to send, or null when the lane is busy or empty
     */
    synchronized String claimNext() {
        if (busy || pending.isEmpty()) {
            return null;
        }
        busy = true;
        return pending.pollFirst();
    }

    synchronized void release() {
        busy = false;
    }

    synchronized int depth() {
        return pending.size();
    }

    synchronized List<String> drain() {
        List<String> ids = new ArrayList<>(pending);
        pending.clear();
        return ids;
    }
}
