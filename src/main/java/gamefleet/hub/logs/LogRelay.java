package gamefleet.hub.logs;

import gamefleet.core.FleetException;
import gamefleet.core.Threads;
import gamefleet.hub.config.HubConfig;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.registry.FleetListener;
import gamefleet.hub.registry.FleetRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Fans one upstream log connection per (spoke, instance) out to any number of subscribers.
 *
 * <p>Upstream lines are appended to a replay ring and offered to each subscriber's bounded
 * buffer without blocking. Buffers drain on a shared delivery pool, one drain per subscriber
 * at a time, so every subscriber sees lines in upstream order.
 */
public final class LogRelay implements FleetListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LogRelay.class);

    private static final Pattern INSTANCE = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final int DRAIN_BATCH = 256;

    private final FleetRegistry registry;
    private final LogUpstreamConnector connector;
    private final int replayLines;
    private final int subscriberBuffer;
    private final ExecutorService delivery;

    private final ConcurrentHashMap<LogChannel.Key, LogChannel> channels = new ConcurrentHashMap<>();

    public LogRelay(FleetRegistry registry, LogUpstreamConnector connector, HubConfig config) {
        this(registry, connector, config.logReplayLines(), config.logSubscriberBuffer(), config.logDeliveryThreads());
    }

    public LogRelay(FleetRegistry registry, LogUpstreamConnector connector,
            int replayLines, int subscriberBuffer, int deliveryThreads) {
        this.registry = registry;
        this.connector = connector;
        this.replayLines = replayLines;
        this.subscriberBuffer = subscriberBuffer;
        this.delivery = Executors.newFixedThreadPool(deliveryThreads, Threads.daemon("gamefleet-logs"));
    }

    /**
     * Subscribe to a spoke instance's console. The first subscriber opens the upstream.
     *
     * @throws FleetException NOT_FOUND for an unknown spoke, INVALID_REQUEST for a bad instance name
     */
    public StreamHandle subscribe(String spokeId, String instance, LogSubscriber subscriber) {
        if (instance == null || !INSTANCE.matcher(instance).matches() || instance.startsWith(".")) {
            throw FleetException.invalid("instance must match [A-Za-z0-9_.-]+");
        }
        Spoke spoke = registry.get(spokeId);
        LogChannel.Key key = new LogChannel.Key(spokeId, instance);

        while (true) {
            LogChannel channel = channels.computeIfAbsent(key, k -> new LogChannel(k, replayLines));
            SubscriberStream stream = channel.attach(subscriber, subscriberBuffer, s -> schedule(channel, s));
            if (stream == null) {
                // lost a race with the last unsubscribe, start over with a fresh channel
                channels.remove(key, channel);
                continue;
            }
            if (channel.claimUpstream()) {
                openUpstream(spoke, channel);
            }
            log.debug("Subscribed to logs of {}/{} ({} subscribers)", spokeId, instance, channel.subscriberCount());
            return new StreamHandle(this, channel, stream);
        }
    }

    /**
     * Stop delivering to this handle. The last unsubscribe closes the upstream.
     */
    public void unsubscribe(StreamHandle handle) {
        if (handle.markClosed()) {
            release(handle.channel(), handle.stream());
        }
    }

    private void release(LogChannel channel, SubscriberStream stream) {
        if (channel.detach(stream)) {
            channels.remove(channel.key(), channel);
            LogUpstream upstream = channel.takeUpstream();
            if (upstream != null) {
                upstream.close();
            }
            log.debug("Closed log channel {}/{}", channel.key().spokeId(), channel.key().instance());
        }
    }

    /**
     * Continue delivery after the subscriber became ready again.
     */
    public void resume(StreamHandle handle) {
        if (handle.stream().resume()) {
            schedule(handle.channel(), handle.stream());
        }
    }

    /**
     * Close every channel of a spoke, notifying its subscribers.
     */
    public void closeSpoke(String spokeId) {
        for (LogChannel channel : channels.values()) {
            if (channel.key().spokeId().equals(spokeId)) {
                closeChannel(channel, "spoke removed");
            }
        }
    }

    @Override
    public void onRemoved(Spoke spoke) {
        closeSpoke(spoke.id());
    }

    public int channelCount() {
        return channels.size();
    }

    public int subscriberCount(String spokeId, String instance) {
        LogChannel channel = channels.get(new LogChannel.Key(spokeId, instance));
        return channel != null ? channel.subscriberCount() : 0;
    }

    private void openUpstream(Spoke spoke, LogChannel channel) {
        LogUpstreamListener listener = new LogUpstreamListener() {
            @Override
            public void onLine(String line) {
                channel.append(LogLine.of(line), s -> schedule(channel, s));
            }

            @Override
            public void onClosed(String reason) {
                closeChannel(channel, reason);
            }
        };
        LogUpstream upstream;
        try {
            upstream = connector.open(spoke, channel.key().instance(), listener);
        } catch (RuntimeException e) {
            log.warn("Failed to open log upstream for {}/{}: {}",
                    spoke.id(), channel.key().instance(), e.getMessage());
            closeChannel(channel, "upstream unavailable: " + e.getMessage());
            return;
        }
        if (!channel.upstreamOpened(upstream)) {
            upstream.close();
        }
    }

    private void closeChannel(LogChannel channel, String reason) {
        channels.remove(channel.key(), channel);
        List<SubscriberStream> open = channel.closeAll();
        LogUpstream upstream = channel.takeUpstream();
        if (upstream != null) {
            upstream.close();
        }
        for (SubscriberStream stream : open) {
            try {
                stream.subscriber().closed(reason);
            } catch (RuntimeException e) {
                log.warn("Log subscriber failed to close: {}", e.getMessage());
            }
        }
        if (!open.isEmpty()) {
            log.info("Log channel {}/{} closed: {}", channel.key().spokeId(), channel.key().instance(), reason);
        }
    }

    private void schedule(LogChannel channel, SubscriberStream stream) {
        try {
            delivery.execute(() -> runDrain(channel, stream));
        } catch (RejectedExecutionException e) {
            log.debug("Log delivery pool closed, dropping drain");
        }
    }

    private void runDrain(LogChannel channel, SubscriberStream stream) {
        boolean more;
        try {
            more = stream.drain(DRAIN_BATCH);
        } catch (RuntimeException e) {
            log.warn("Log subscriber failed, detaching it: {}", e.getMessage());
            release(channel, stream);
            try {
                stream.subscriber().closed("delivery failed");
            } catch (RuntimeException ignored) {
                log.debug("Failed subscriber also failed to close");
            }
            return;
        }
        if (more) {
            schedule(channel, stream);
        }
    }

    @Override
    public void close() {
        for (LogChannel channel : channels.values()) {
            closeChannel(channel, "hub shutting down");
        }
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(2, TimeUnit.SECONDS)) {
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
