package gamefleet.hub.events;

import gamefleet.core.Threads;
import gamefleet.hub.model.TransitionEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded queue of transition events with a single consumer thread.
 * Publishing never blocks; a full queue drops the event.
 */
public final class TransitionEventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TransitionEventBus.class);

    private final BlockingQueue<TransitionEvent> queue;
    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService consumer = Executors.newSingleThreadExecutor(Threads.daemon("gamefleet-events"));
    private final AtomicLong dropped = new AtomicLong();

    private volatile boolean running = false;

    public TransitionEventBus(int capacity) {
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    public void subscribe(TransitionListener listener) {
        listeners.add(listener);
    }

    public void start() {
        if (running) {
            return;
        }
        running = true;
        consumer.execute(this::drainLoop);
        log.info("Transition event bus started");
    }

    /**
     * @return false when the queue is full and the event was dropped
     */
    public boolean publish(TransitionEvent event) {
        if (queue.offer(event)) {
            return true;
        }
        long total = dropped.incrementAndGet();
        log.warn("Transition queue full, dropped {} -> {} for spoke {} ({} dropped so far)",
                event.from(), event.to(), event.spokeId(), total);
        return false;
    }

    public long droppedCount() {
        return dropped.get();
    }

    private void drainLoop() {
        while (running) {
            TransitionEvent event;
            try {
                event = queue.poll(200, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (event != null) {
                deliver(event);
            }
        }
    }

    private void deliver(TransitionEvent event) {
        for (TransitionListener listener : listeners) {
            try {
                listener.onTransition(event);
            } catch (RuntimeException e) {
                log.error("Transition listener {} failed for spoke {}",
                        listener.getClass().getSimpleName(), event.spokeId(), e);
            }
        }
    }

    @Override
    public void close() {
        running = false;
        consumer.shutdown();
        try {
            if (!consumer.awaitTermination(2, TimeUnit.SECONDS)) {
                consumer.shutdownNow();
            }
        } catch (InterruptedException e) {
            consumer.shutdownNow();
            Thread.currentThread().interrupt();
        }
        // flush what is left so the history stays complete
        TransitionEvent event;
        while ((event = queue.poll()) != null) {
            deliver(event);
        }
    }
}
