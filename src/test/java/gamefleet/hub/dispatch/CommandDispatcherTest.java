package gamefleet.hub.dispatch;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.hub.client.SpokeCallException;
import gamefleet.hub.config.HubConfig;
import gamefleet.hub.heartbeat.HeartbeatStateMachine;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.CommandState;
import gamefleet.hub.model.CommandVerb;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.registry.RegistrationRequest;
import gamefleet.hub.store.Database;
import gamefleet.hub.store.JdbcCommandRepository;
import gamefleet.hub.store.JdbcSpokeRepository;
import gamefleet.protocol.CommandReport;
import gamefleet.security.AuthException;
import gamefleet.security.AuthFailure;
import gamefleet.security.Principal;
import gamefleet.security.Role;
import gamefleet.testing.FakeSpokeClient;
import gamefleet.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

class CommandDispatcherTest {

    private static final Principal OPERATOR = new Principal("olga", Role.OPERATOR, "t-1");
    private static final Principal VIEWER = new Principal("vic", Role.VIEWER, "t-2");
    private static final Principal ADMIN = new Principal("ada", Role.ADMIN, "t-3");

    private Database db;
    private FleetRegistry registry;
    private JdbcCommandRepository commands;
    private FakeSpokeClient client;
    private ExecutorService outbound;
    private CommandDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("dispatch");
        registry = new FleetRegistry(new JdbcSpokeRepository(db), new HeartbeatStateMachine(2, 3),
                Clock.systemUTC(), 10);
        commands = new JdbcCommandRepository(db);
        client = new FakeSpokeClient();
        outbound = Executors.newFixedThreadPool(4);
        dispatcher = newDispatcher(Duration.ofSeconds(5));
        registry.addListener(dispatcher);
    }

    private CommandDispatcher newDispatcher(Duration executionTimeout) {
        HubConfig config = HubConfig.defaults()
                .withCommandAckTimeout(Duration.ofMillis(500))
                .withCommandPollInterval(Duration.ofMillis(50))
                .withCommandExecutionTimeout(executionTimeout)
                .withAllowDispatchToDegraded(false);
        return new CommandDispatcher(registry, commands, client, outbound, config, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
        outbound.shutdownNow();
        db.close();
    }

    private String onlineSpoke(String name, String address) {
        String id = registry.register(new RegistrationRequest(name, address, "k", null)).spokeId();
        registry.updateStatus(id, SpokeStatus.ONLINE);
        return id;
    }

    private Command start(String spokeId, String instance) {
        return dispatcher.dispatch(new DispatchRequest(spokeId, CommandVerb.START, instance, null), OPERATOR);
    }

    private void awaitState(String commandId, CommandState state) {
        await().atMost(Duration.ofSeconds(5)).until(() -> dispatcher.get(commandId).state() == state);
    }

    @Test
    void dispatchToOfflineSpokeFailsWithoutRow() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        registry.updateStatus(id, SpokeStatus.OFFLINE);

        FleetException e = assertThrows(FleetException.class, () -> start(id, "vhserver"));
        assertEquals(ErrorKind.SPOKE_UNREACHABLE, e.kind());
        assertTrue(dispatcher.history(id, 10).isEmpty());
        assertTrue(client.sent().isEmpty());
    }

    @Test
    void dispatchToPendingSpokeIsRefused() {
        String id = registry.register(new RegistrationRequest("S1", "10.0.0.5:49950", "k", null)).spokeId();
        FleetException e = assertThrows(FleetException.class, () -> start(id, "vhserver"));
        assertEquals(ErrorKind.SPOKE_UNREACHABLE, e.kind());
    }

    @Test
    void degradedSpokeIsRefusedWhenPolicyForbidsIt() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        registry.updateStatus(id, SpokeStatus.DEGRADED);
        assertThrows(FleetException.class, () -> start(id, "vhserver"));
    }

    @Test
    void unknownSpokeIsNotFound() {
        FleetException e = assertThrows(FleetException.class, () -> start("missing", "vhserver"));
        assertEquals(ErrorKind.NOT_FOUND, e.kind());
    }

    @Test
    void verbsRequireRoles() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");

        AuthException viewer = assertThrows(AuthException.class, () -> dispatcher.dispatch(
                new DispatchRequest(id, CommandVerb.START, "vhserver", null), VIEWER));
        assertEquals(AuthFailure.UNAUTHORIZED, viewer.failure());

        assertThrows(AuthException.class, () -> dispatcher.dispatch(
                new DispatchRequest(id, CommandVerb.UPDATE, "vhserver", null), OPERATOR));

        Command update = dispatcher.dispatch(new DispatchRequest(id, CommandVerb.UPDATE, "vhserver", null), ADMIN);
        assertEquals("update", update.action());
        assertTrue(dispatcher.history(id, 10).stream().allMatch(c -> c.verb() == CommandVerb.UPDATE));
    }

    @Test
    void rejectsMalformedTargets() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");

        FleetException traversal = assertThrows(FleetException.class, () -> start(id, "../etc"));
        assertEquals(ErrorKind.INVALID_REQUEST, traversal.kind());

        FleetException custom = assertThrows(FleetException.class, () -> dispatcher.dispatch(
                new DispatchRequest(id, CommandVerb.CUSTOM, "vhserver", "rm -rf"), ADMIN));
        assertEquals(ErrorKind.INVALID_REQUEST, custom.kind());
        assertTrue(dispatcher.history(id, 10).isEmpty());
    }

    @Test
    void commandRunsToSuccess() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");

        Command command = start(id, "vhserver");
        assertEquals(CommandState.QUEUED, command.state());
        assertEquals("olga", command.issuedBy());

        awaitState(command.id(), CommandState.ACKNOWLEDGED);
        client.finish(command.id(), 0, "Starting vhserver: OK");
        awaitState(command.id(), CommandState.SUCCEEDED);

        String detail = dispatcher.get(command.id()).resultDetail();
        assertTrue(detail.contains("exit code 0"), detail);
        assertTrue(detail.contains("Starting vhserver: OK"), detail);
        assertEquals("start", client.sent().get(0).action());
    }

    @Test
    void finishedAcknowledgmentCompletesImmediately() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        client.onSend((spoke, cmd) -> new CommandReport(cmd.id(), CommandReport.FAILED, 3, "no such server"));

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.FAILED);
        assertTrue(dispatcher.get(command.id()).resultDetail().contains("exit code 3"));
    }

    @Test
    void unansweredSendTimesOut() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        client.setReachable(id, false);

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.TIMED_OUT);
    }

    @Test
    void rejectedSendFails() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        client.onSend((spoke, cmd) -> {
            throw new SpokeCallException(400, "action not allowed: update");
        });

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.FAILED);
        String detail = dispatcher.get(command.id()).resultDetail();
        assertTrue(detail.contains("HTTP 400"), detail);
    }

    @Test
    void forgottenCommandFails() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        client.onSend((spoke, cmd) -> {
            client.forget(cmd.id());
            return new CommandReport(cmd.id(), CommandReport.RUNNING, null, "");
        });

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.FAILED);
        assertEquals("spoke has no record of the command", dispatcher.get(command.id()).resultDetail());
    }

    @Test
    void commandWithoutReportTimesOut() {
        dispatcher.close();
        dispatcher = newDispatcher(Duration.ofMillis(300));
        String id = onlineSpoke("S1", "10.0.0.5:49950");

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.TIMED_OUT);
    }

    @Test
    void commandsForOneSpokeAreSerialized() throws Exception {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        CountDownLatch release = new CountDownLatch(1);
        client.onSend((spoke, cmd) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, "");
        });

        Command first = start(id, "vhserver");
        await().atMost(Duration.ofSeconds(5)).until(() -> client.sent().size() == 1);
        Command second = start(id, "vhserver");

        Thread.sleep(200);
        assertEquals(1, client.sent().size());
        assertEquals(CommandState.SENT, dispatcher.get(first.id()).state());
        assertEquals(CommandState.QUEUED, dispatcher.get(second.id()).state());
        assertEquals(1, dispatcher.queueDepth(id));

        release.countDown();
        awaitState(first.id(), CommandState.SUCCEEDED);
        awaitState(second.id(), CommandState.SUCCEEDED);
        assertEquals(List.of(first.id(), second.id()), client.sent().stream().map(Command::id).toList());
    }

    @Test
    void differentSpokesDoNotWaitForEachOther() {
        String slow = onlineSpoke("S1", "10.0.0.5:49950");
        String fast = onlineSpoke("S2", "10.0.0.6:49950");
        CountDownLatch release = new CountDownLatch(1);
        client.onSend((spoke, cmd) -> {
            if (spoke.id().equals(slow)) {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, "");
        });

        Command blocked = start(slow, "vhserver");
        Command other = start(fast, "csgoserver");
        awaitState(other.id(), CommandState.SUCCEEDED);
        assertEquals(CommandState.SENT, dispatcher.get(blocked.id()).state());

        release.countDown();
        awaitState(blocked.id(), CommandState.SUCCEEDED);
    }

    @Test
    void removingSpokeCancelsItsCommands() throws Exception {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        CountDownLatch release = new CountDownLatch(1);
        client.onSend((spoke, cmd) -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, "");
        });

        Command inFlight = start(id, "vhserver");
        await().atMost(Duration.ofSeconds(5)).until(() -> client.sent().size() == 1);
        Command queued = start(id, "vhserver");

        registry.remove(id);
        assertEquals(CommandState.FAILED, dispatcher.get(inFlight.id()).state());
        assertEquals(CommandState.FAILED, dispatcher.get(queued.id()).state());
        assertEquals("cancelled: spoke removed", dispatcher.get(queued.id()).resultDetail());

        release.countDown();
        Thread.sleep(300);
        assertEquals(CommandState.FAILED, dispatcher.get(inFlight.id()).state());
        assertEquals(1, client.sent().size());
    }

    @Test
    void dispatchRacingRemovalLeavesNoLaneBehind() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        JdbcCommandRepository removingOnInsert = new JdbcCommandRepository(db) {
            @Override
            public void insert(Command command) {
                registry.remove(command.spokeId());
                super.insert(command);
            }
        };
        HubConfig config = HubConfig.defaults().withCommandAckTimeout(Duration.ofMillis(500));
        CommandDispatcher racing = new CommandDispatcher(registry, removingOnInsert, client, outbound, config,
                Clock.systemUTC());
        registry.addListener(racing);
        try {
            Command command = racing.dispatch(new DispatchRequest(id, CommandVerb.START, "vhserver", null), OPERATOR);

            assertEquals(CommandState.FAILED, command.state());
            assertEquals("cancelled: spoke removed", command.resultDetail());
            assertFalse(racing.hasLane(id));
            assertEquals(0, racing.queueDepth(id));
            assertTrue(client.sent().isEmpty());
        } finally {
            racing.close();
        }
    }

    @Test
    void terminalStatesNeverChange() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        client.onSend((spoke, cmd) -> new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, ""));
        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.SUCCEEDED);

        assertFalse(commands.advance(command.id(), CommandState.FAILED, "late", Instant.now()));
        assertFalse(commands.advance(command.id(), CommandState.SENT, null, Instant.now()));
        assertEquals(CommandState.SUCCEEDED, dispatcher.get(command.id()).state());
    }

    @Test
    void recoveryResumesUnfinishedCommands() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        Instant now = Instant.now();
        Command queued = Command.builder().id("c-queued").spokeId(id).verb(CommandVerb.START)
                .targetInstance("vhserver").issuedBy("olga").issuedAt(now)
                .state(CommandState.QUEUED).updatedAt(now).build();
        Command sent = Command.builder().id("c-sent").spokeId(id).verb(CommandVerb.STOP)
                .targetInstance("vhserver").issuedBy("olga").issuedAt(now.minusSeconds(1))
                .state(CommandState.SENT).updatedAt(now).build();
        commands.insert(sent);
        commands.insert(queued);
        client.onSend((spoke, cmd) -> new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, ""));

        dispatcher.recover();

        awaitState("c-queued", CommandState.SUCCEEDED);
        assertEquals(CommandState.TIMED_OUT, dispatcher.get("c-sent").state());
    }

    @Test
    void resultDetailKeepsTheTail() {
        String id = onlineSpoke("S1", "10.0.0.5:49950");
        String output = "x".repeat(5000) + "END";
        client.onSend((spoke, cmd) -> new CommandReport(cmd.id(), CommandReport.SUCCEEDED, 0, output));

        Command command = start(id, "vhserver");
        awaitState(command.id(), CommandState.SUCCEEDED);
        String detail = dispatcher.get(command.id()).resultDetail();
        assertEquals(4096, detail.length());
        assertTrue(detail.endsWith("END"));
    }
}
