package gamefleet.hub.registry;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.hub.heartbeat.HeartbeatStateMachine;
import gamefleet.hub.model.HeartbeatSample;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.model.SpokeMetrics;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.repository.SpokeRepository;
import gamefleet.hub.store.Database;
import gamefleet.hub.store.JdbcSpokeRepository;
import gamefleet.security.ApiKeys;
import gamefleet.security.SpokeIdentity;
import gamefleet.testing.MutableClock;
import gamefleet.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class FleetRegistryTest {

    private Database db;
    private JdbcSpokeRepository repository;
    private MutableClock clock;
    private FleetRegistry registry;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("registry");
        repository = new JdbcSpokeRepository(db);
        clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        registry = new FleetRegistry(repository, new HeartbeatStateMachine(2, 3), clock, 5);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private String registerS1() {
        return registry.register(new RegistrationRequest("S1", "10.0.0.5:49950", "k1", "10.0.0.5")).spokeId();
    }

    private Optional<TransitionEvent> beat(String id, boolean reachable) {
        HeartbeatSample sample = reachable
                ? HeartbeatSample.success(id, clock.instant(), SpokeMetrics.empty())
                : HeartbeatSample.failure(id, clock.instant(), "timeout");
        return registry.recordHeartbeat(id, sample);
    }

    @Test
    void registrationStartsPending() {
        RegistrationResult result = registry.register(
                new RegistrationRequest("S1", "10.0.0.5:49950", "k1", "10.0.0.5"));

        assertTrue(result.created());
        Spoke spoke = registry.get(result.spokeId());
        assertEquals("S1", spoke.name());
        assertEquals(SpokeStatus.PENDING, spoke.status());
        assertEquals(ApiKeys.hash("k1"), spoke.apiKeyHash());
        assertTrue(repository.findById(result.spokeId()).isPresent());
    }

    @Test
    void reRegistrationAtSameAddressKeepsId() {
        String id = registerS1();

        RegistrationResult again = registry.register(
                new RegistrationRequest("S1-renamed", "HTTP://10.0.0.5:49950/", "k2", "10.0.0.5"));

        assertFalse(again.created());
        assertEquals(id, again.spokeId());
        assertEquals(1, registry.size());
        assertEquals("S1-renamed", registry.get(id).name());
        assertEquals(ApiKeys.hash("k2"), registry.get(id).apiKeyHash());
    }

    @Test
    void listKeepsRegistrationOrder() {
        String a = registry.register(new RegistrationRequest("A", "10.0.0.7:49950", "k", null)).spokeId();
        String b = registry.register(new RegistrationRequest("B", "10.0.0.3:49950", "k", null)).spokeId();
        String c = registry.register(new RegistrationRequest("C", "10.0.0.9:49950", "k", null)).spokeId();

        List<String> ids = registry.list().stream().map(Spoke::id).toList();
        assertEquals(List.of(a, b, c), ids);
    }

    @Test
    void rejectsIncompleteRegistration() {
        FleetException e = assertThrows(FleetException.class,
                () -> registry.register(new RegistrationRequest("S1", "10.0.0.5:49950", " ", null)));
        assertEquals(ErrorKind.INVALID_REQUEST, e.kind());

        FleetException badIp = assertThrows(FleetException.class,
                () -> registry.register(new RegistrationRequest("S1", "10.0.0.5:49950", "k", "not-an-ip")));
        assertEquals(ErrorKind.INVALID_REQUEST, badIp.kind());
        assertEquals(0, registry.size());
    }

    @Test
    void transitionsAreEdgeTriggered() {
        String id = registerS1();
        List<TransitionEvent> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            beat(id, true).ifPresent(events::add);
        }

        assertEquals(1, events.size());
        assertEquals(SpokeStatus.PENDING, events.get(0).from());
        assertEquals(SpokeStatus.ONLINE, events.get(0).to());
        assertEquals("S1", events.get(0).spokeName());
    }

    @Test
    void missedHeartbeatsDegradeThenOffline() {
        String id = registerS1();
        beat(id, true);

        assertTrue(beat(id, false).isEmpty());
        TransitionEvent degraded = beat(id, false).orElseThrow();
        assertEquals(SpokeStatus.ONLINE, degraded.from());
        assertEquals(SpokeStatus.DEGRADED, degraded.to());

        TransitionEvent offline = beat(id, false).orElseThrow();
        assertEquals(SpokeStatus.DEGRADED, offline.from());
        assertEquals(SpokeStatus.OFFLINE, offline.to());
        assertEquals(3, registry.get(id).consecutiveFailures());

        TransitionEvent back = beat(id, true).orElseThrow();
        assertEquals(SpokeStatus.OFFLINE, back.from());
        assertEquals(SpokeStatus.ONLINE, back.to());
        assertEquals(0, registry.get(id).consecutiveFailures());
    }

    @Test
    void pendingSpokeStaysPendingWhenUnreachable() {
        String id = registerS1();
        for (int i = 0; i < 5; i++) {
            assertTrue(beat(id, false).isEmpty());
        }
        assertEquals(SpokeStatus.PENDING, registry.get(id).status());
    }

    @Test
    void heartbeatHistoryIsBounded() {
        String id = registerS1();
        for (int i = 0; i < 8; i++) {
            clock.advance(Duration.ofSeconds(60));
            beat(id, true);
        }
        List<HeartbeatSample> samples = registry.recentHeartbeats(id);
        assertEquals(5, samples.size());
        assertEquals(clock.instant(), samples.get(4).timestamp());
    }

    @Test
    void successRecordsLastSeen() {
        String id = registerS1();
        beat(id, true);
        assertEquals(clock.instant(), registry.get(id).lastSeen());
    }

    @Test
    void degradeIfStaleOnlyAffectsOnlineSpokes() {
        String id = registerS1();
        assertTrue(registry.degradeIfStale(id, clock.instant()).isEmpty());

        beat(id, true);
        Instant seen = clock.instant();
        assertTrue(registry.degradeIfStale(id, seen).isEmpty());

        TransitionEvent event = registry.degradeIfStale(id, seen.plusSeconds(1)).orElseThrow();
        assertEquals(SpokeStatus.DEGRADED, event.to());
        assertEquals(SpokeStatus.DEGRADED, registry.get(id).status());
    }

    @Test
    void updateStatusRejectsDisallowedEdges() {
        String id = registerS1();
        assertTrue(registry.updateStatus(id, SpokeStatus.OFFLINE).isEmpty());
        assertTrue(registry.updateStatus(id, SpokeStatus.ONLINE).isPresent());
        assertTrue(registry.updateStatus(id, SpokeStatus.ONLINE).isEmpty());
    }

    @Test
    void removalNotifiesListenersAndForgetsSpoke() {
        String id = registerS1();
        List<String> removed = new ArrayList<>();
        registry.addListener(spoke -> removed.add(spoke.id()));

        registry.remove(id);

        assertEquals(List.of(id), removed);
        assertTrue(registry.find(id).isEmpty());
        assertTrue(repository.findById(id).isEmpty());
        assertTrue(beat(id, true).isEmpty());

        FleetException e = assertThrows(FleetException.class, () -> registry.remove(id));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void addressIsFreeAgainAfterRemoval() {
        String id = registerS1();
        registry.remove(id);

        RegistrationResult again = registry.register(
                new RegistrationRequest("S1", "10.0.0.5:49950", "k1", "10.0.0.5"));
        assertTrue(again.created());
        assertNotEquals(id, again.spokeId());
    }

    @Test
    void identityCarriesKeyHashAndAllowlist() {
        String id = registerS1();
        SpokeIdentity identity = registry.findIdentity(id).orElseThrow();
        assertEquals(id, identity.spokeId());
        assertEquals(ApiKeys.hash("k1"), identity.apiKeyHash());
        assertEquals("10.0.0.5", identity.allowedSourceIp());
        assertTrue(registry.findIdentity("nope").isEmpty());
    }

    @Test
    void persistedSpokesSurviveRestart() {
        String id = registerS1();
        beat(id, true);

        FleetRegistry restarted = new FleetRegistry(repository, new HeartbeatStateMachine(2, 3), clock, 5);
        assertEquals(1, restarted.loadPersisted());
        assertEquals(SpokeStatus.ONLINE, restarted.get(id).status());

        RegistrationResult again = restarted.register(
                new RegistrationRequest("S1", "10.0.0.5:49950", "k1", "10.0.0.5"));
        assertFalse(again.created());
        assertEquals(id, again.spokeId());
    }

    @Test
    void countsByStatus() {
        String id = registerS1();
        registry.register(new RegistrationRequest("S2", "10.0.0.6:49950", "k", null));
        beat(id, true);

        assertEquals(1, registry.countByStatus().get(SpokeStatus.ONLINE));
        assertEquals(1, registry.countByStatus().get(SpokeStatus.PENDING));
        assertEquals(0, registry.countByStatus().get(SpokeStatus.OFFLINE));
    }

    @Test
    void recoveryFromDegradedEmitsOneEvent() {
        String id = registerS1();
        beat(id, true);
        assertTrue(beat(id, false).isEmpty());
        assertEquals(SpokeStatus.DEGRADED, beat(id, false).orElseThrow().to());

        List<TransitionEvent> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            beat(id, true).ifPresent(events::add);
        }

        assertEquals(1, events.size());
        assertEquals(SpokeStatus.DEGRADED, events.get(0).from());
        assertEquals(SpokeStatus.ONLINE, events.get(0).to());
        assertEquals(0, registry.get(id).consecutiveFailures());
    }

    @Test
    void reRegistrationDuringRemovalDoesNotDeadlock() throws Exception {
        CountDownLatch deleting = new CountDownLatch(1);
        SpokeRepository slowDelete = new SpokeRepository() {
            @Override
            public void save(Spoke spoke) {
                repository.save(spoke);
            }

            @Override
            public Optional<Spoke> findById(String spokeId) {
                return repository.findById(spokeId);
            }

            @Override
            public List<Spoke> findAll() {
                return repository.findAll();
            }

            @Override
            public boolean delete(String spokeId) {
                deleting.countDown();
                try {
                    Thread.sleep(300);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return repository.delete(spokeId);
            }

            @Override
            public long nextRegistrationSeq() {
                return repository.nextRegistrationSeq();
            }
        };
        FleetRegistry slow = new FleetRegistry(slowDelete, new HeartbeatStateMachine(2, 3), clock, 5);
        String id = slow.register(new RegistrationRequest("S1", "10.0.0.5:49950", "k1", "10.0.0.5")).spokeId();

        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Spoke> removal = pool.submit(() -> slow.remove(id));
            assertTrue(deleting.await(5, TimeUnit.SECONDS));
            Future<RegistrationResult> registration = pool.submit(() -> slow.register(
                    new RegistrationRequest("S1", "10.0.0.5:49950", "k2", "10.0.0.5")));

            assertEquals(id, removal.get(5, TimeUnit.SECONDS).id());
            RegistrationResult result = registration.get(5, TimeUnit.SECONDS);

            assertTrue(result.created());
            assertNotEquals(id, result.spokeId());
            assertEquals(1, slow.size());
            RegistrationResult again = slow.register(
                    new RegistrationRequest("S1", "10.0.0.5:49950", "k3", "10.0.0.5"));
            assertFalse(again.created());
            assertEquals(result.spokeId(), again.spokeId());
        } finally {
            pool.shutdownNow();
        }
    }
}
