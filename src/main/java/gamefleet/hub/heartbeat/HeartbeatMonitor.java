package gamefleet.hub.heartbeat;

import gamefleet.core.Threads;
import gamefleet.hub.config.HubConfig;
import gamefleet.hub.events.TransitionEventBus;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.registry.FleetListener;
import gamefleet.hub.registry.FleetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Polls every registered spoke on its own schedule and drives the liveness state machine.
 *
 * <p>Ticks only submit probes; the blocking call runs on the shared outbound pool.
 * A tick is skipped while the previous probe for the same spoke is still in flight.
 */
public final class HeartbeatMonitor implements FleetListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatMonitor.class);

    private final FleetRegistry registry;
    private final SpokeProbe probe;
    private final TransitionEventBus bus;
    private final ExecutorService outbound;
    private final Clock clock;

    private final Duration interval;
    private final Duration jitter;
    private final Duration graceWindow;
    private final Duration graceSweepInterval;

    private final ScheduledExecutorService scheduler =
            Executors.newScheduledThreadPool(2, Threads.daemon("gamefleet-heartbeat"));
    private final ConcurrentHashMap<String, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;

    public HeartbeatMonitor(FleetRegistry registry,
            SpokeProbe probe,
            TransitionEventBus bus,
            ExecutorService outbound,
            HubConfig config,
            Clock clock) {
        this.registry = registry;
        this.probe = probe;
        this.bus = bus;
        this.outbound = outbound;
        this.clock = clock;
        this.interval = config.heartbeatInterval();
        this.jitter = config.heartbeatJitter();
        this.graceWindow = config.graceWindow();
        this.graceSweepInterval = config.graceSweepInterval();
    }

    /**
     * Schedule every spoke already in the registry and start the grace sweep.
     */
    public void start() {
        if (running) {
            log.warn("Heartbeat monitor already running");
            return;
        }
        running = true;
        for (Spoke spoke : registry.list()) {
            schedule(spoke.id());
        }
        long sweepMs = graceSweepInterval.toMillis();
        scheduler.scheduleAtFixedRate(wrapRunnable("grace-sweep", this::sweepGrace),
                sweepMs, sweepMs, TimeUnit.MILLISECONDS);
        log.info("Heartbeat monitor started: {} spokes, interval {}ms, grace window {}",
                tasks.size(), interval.toMillis(), graceWindow);
    }

    @Override
    public void onRegistered(Spoke spoke) {
        if (running) {
            schedule(spoke.id());
        }
    }

    @Override
    public void onRemoved(Spoke spoke) {
        ScheduledFuture<?> future = tasks.remove(spoke.id());
        if (future != null) {
            future.cancel(false);
            log.debug("Cancelled heartbeat for spoke {}", spoke.id());
        }
    }

    /**
     * Probe a spoke now, outside its schedule.
     *
     * @return false when a probe for this spoke is already in flight
     */
    public boolean pollNow(String spokeId) {
        registry.get(spokeId);
        return tick(spokeId);
    }

    public int scheduledCount() {
        return tasks.size();
    }

    private void schedule(String spokeId) {
        long intervalMs = interval.toMillis();
        long jitterMs = jitter.toMillis();
        long delay = jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0;
        tasks.computeIfAbsent(spokeId, id -> scheduler.scheduleAtFixedRate(
                wrapRunnable("heartbeat-" + id, () -> tick(id)),
                delay, intervalMs, TimeUnit.MILLISECONDS));
    }

    private boolean tick(String spokeId) {
        if (!inFlight.add(spokeId)) {
            log.debug("Previous probe of spoke {} still running, skipping tick", spokeId);
            return false;
        }
        try {
            outbound.execute(() -> probeAndRecord(spokeId));
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(spokeId);
            log.warn("Outbound pool rejected probe of spoke {}", spokeId);
            return false;
        }
    }

    private void probeAndRecord(String spokeId) {
        try {
            Optional<Spoke> spoke = registry.find(spokeId);
            if (spoke.isEmpty()) {
                return;
            }
            HeartbeatSample sample = probe.probe(spoke.get());
            if (!sample.reachable()) {
                log.debug("Heartbeat failed for spoke {}: {}", spokeId, sample.failureReason());
            }
            registry.recordHeartbeat(spokeId, sample).ifPresent(this::publish);
        } catch (RuntimeException e) {
            log.error("Heartbeat processing failed for spoke {}", spokeId, e);
        } finally {
            inFlight.remove(spokeId);
        }
    }

    void sweepGrace() {
        Instant cutoff = clock.instant().minus(graceWindow);
        for (Spoke spoke : registry.list()) {
            registry.degradeIfStale(spoke.id(), cutoff).ifPresent(this::publish);
        }
    }

    private void publish(TransitionEvent event) {
        log.info("Spoke {} ({}) {} -> {}", event.spokeName(), event.spokeId(), event.from(), event.to());
        bus.publish(event);
    }

    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }

    @Override
    public void close() {
        running = false;
        tasks.values().forEach(f -> f.cancel(false));
        tasks.clear();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
                log.warn("Heartbeat scheduler forcefully stopped");
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
