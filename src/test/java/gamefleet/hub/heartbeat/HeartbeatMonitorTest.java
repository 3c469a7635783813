package gamefleet.hub.heartbeat;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.hub.config.HubConfig;
import gamefleet.hub.events.TransitionEventBus;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.SpokeMetrics;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.registry.RegistrationRequest;
import gamefleet.hub.store.Database;
import gamefleet.hub.store.JdbcSpokeRepository;
import gamefleet.testing.FakeSpokeClient;
import gamefleet.testing.MutableClock;
import gamefleet.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class HeartbeatMonitorTest {

    private Database db;
    private FleetRegistry registry;
    private FakeSpokeClient client;
    private TransitionEventBus bus;
    private ExecutorService outbound;
    private HeartbeatMonitor monitor;
    private final List<TransitionEvent> events = new CopyOnWriteArrayList<>();

    private HubConfig config() {
        return HubConfig.defaults()
                .withHeartbeatInterval(Duration.ofMillis(100))
                .withHeartbeatJitter(Duration.ZERO)
                .withHeartbeatTimeout(Duration.ofMillis(50))
                .withThresholds(2, 3);
    }

    private void build(Clock clock) {
        registry = new FleetRegistry(new JdbcSpokeRepository(db), new HeartbeatStateMachine(2, 3), clock, 20);
        bus = new TransitionEventBus(64);
        bus.subscribe(events::add);
        bus.start();
        monitor = new HeartbeatMonitor(registry, new SpokeProbe(client, Duration.ofMillis(50), clock),
                bus, outbound, config(), clock);
        registry.addListener(monitor);
    }

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("monitor");
        client = new FakeSpokeClient();
        outbound = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
        bus.close();
        outbound.shutdownNow();
        db.close();
    }

    private String register(String name, String address) {
        return registry.register(new RegistrationRequest(name, address, "key-" + name, null)).spokeId();
    }

    @Test
    void reachableSpokeComesOnlineOnce() {
        build(Clock.systemUTC());
        String id = register("S1", "10.0.0.5:49950");
        monitor.start();

        await().atMost(Duration.ofSeconds(5)).until(() -> client.statusCalls(id) >= 5);
        assertEquals(SpokeStatus.ONLINE, registry.get(id).status());
        await().atMost(Duration.ofSeconds(2)).until(() -> events.size() == 1);
        assertEquals(SpokeStatus.PENDING, events.get(0).from());
        assertEquals(SpokeStatus.ONLINE, events.get(0).to());
    }

    @Test
    void spokeRegisteredAfterStartIsScheduled() {
        build(Clock.systemUTC());
        monitor.start();
        String id = register("S1", "10.0.0.5:49950");

        assertEquals(1, monitor.scheduledCount());
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.get(id).status() == SpokeStatus.ONLINE);
    }

    @Test
    void unreachableSpokeDegradesThenGoesOffline() {
        build(Clock.systemUTC());
        String id = register("S1", "10.0.0.5:49950");
        monitor.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.get(id).status() == SpokeStatus.ONLINE);

        client.setReachable(id, false);
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.get(id).status() == SpokeStatus.OFFLINE);

        await().atMost(Duration.ofSeconds(2)).until(() -> events.size() == 3);
        assertEquals(List.of(SpokeStatus.ONLINE, SpokeStatus.DEGRADED, SpokeStatus.OFFLINE),
                events.stream().map(TransitionEvent::to).toList());
        assertEquals(SpokeStatus.DEGRADED, events.get(2).from());
    }

    @Test
    void removalStopsProbing() throws Exception {
        build(Clock.systemUTC());
        String id = register("S1", "10.0.0.5:49950");
        monitor.start();
        await().atMost(Duration.ofSeconds(5)).until(() -> client.statusCalls(id) >= 2);

        registry.remove(id);
        assertEquals(0, monitor.scheduledCount());
        Thread.sleep(150);
        int calls = client.statusCalls(id);
        Thread.sleep(400);
        assertEquals(calls, client.statusCalls(id));
    }

    @Test
    void pollNowProbesImmediately() {
        build(Clock.systemUTC());
        String id = register("S1", "10.0.0.5:49950");

        assertTrue(monitor.pollNow(id));
        await().atMost(Duration.ofSeconds(5)).until(() -> registry.get(id).status() == SpokeStatus.ONLINE);
    }

    @Test
    void pollNowRejectsUnknownSpoke() {
        build(Clock.systemUTC());
        FleetException e = assertThrows(FleetException.class, () -> monitor.pollNow("missing"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void graceSweepDegradesSilentSpokes() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        build(clock);
        String id = register("S1", "10.0.0.5:49950");
        registry.recordHeartbeat(id, HeartbeatSample.success(id, clock.instant(), SpokeMetrics.empty()));

        clock.advance(Duration.ofMinutes(2));
        monitor.sweepGrace();
        assertEquals(SpokeStatus.ONLINE, registry.get(id).status());

        clock.advance(Duration.ofMinutes(2));
        monitor.sweepGrace();
        assertEquals(SpokeStatus.DEGRADED, registry.get(id).status());
        await().atMost(Duration.ofSeconds(2)).until(() -> events.size() == 1);
        assertEquals(SpokeStatus.DEGRADED, events.get(0).to());
    }
}
