package gamefleet.core;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories for the hub and agent executors.
 */
public final class Threads {

    private Threads() {
    }

    /**
     * Daemon threads named {@code <prefix>-<n>}.
     */
    public static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        };
    }
}
