package gamefleet.hub.dispatch;

import gamefleet.core.FleetException;
import gamefleet.core.Threads;
import gamefleet.hub.client.SpokeCallException;
import gamefleet.hub.client.SpokeClient;
import gamefleet.hub.config.HubConfig;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.CommandState;
import gamefleet.hub.model.CommandVerb;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.registry.FleetListener;
import gamefleet.hub.registry.FleetRegistry;
import gamefleet.hub.repository.CommandRepository;
import gamefleet.protocol.CommandReport;
import gamefleet.security.Principal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Accepts operator commands and delivers them to spokes one at a time per spoke.
 *
 * <p>{@link #dispatch} validates and persists the command in QUEUED and returns.
 * Delivery, acknowledgment and completion polling happen on the outbound pool and
 * are recorded on the command row; nothing is thrown back to the caller after that.
 * Commands are never retried.
 */
public final class CommandDispatcher implements FleetListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private static final Pattern INSTANCE = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final Pattern CUSTOM_ACTION = Pattern.compile("[a-z-]+");
    private static final int MAX_DETAIL = 4096;

    private final FleetRegistry registry;
    private final CommandRepository repository;
    private final SpokeClient client;
    private final ExecutorService outbound;
    private final Clock clock;
    private final VerbAuthorizer authorizer = new VerbAuthorizer();

    private final Duration ackTimeout;
    private final Duration pollInterval;
    private final Duration executionTimeout;
    private final boolean allowDegraded;

    private final ScheduledExecutorService pollScheduler =
            Executors.newSingleThreadScheduledExecutor(Threads.daemon("gamefleet-dispatch"));
    private final ConcurrentHashMap<String, CommandLane> lanes = new ConcurrentHashMap<>();

    private volatile boolean closed = false;

    public CommandDispatcher(FleetRegistry registry,
            CommandRepository repository,
            SpokeClient client,
            ExecutorService outbound,
            HubConfig config,
            Clock clock) {
        this.registry = registry;
        this.repository = repository;
        this.client = client;
        this.outbound = outbound;
        this.clock = clock;
        this.ackTimeout = config.commandAckTimeout();
        this.pollInterval = config.commandPollInterval();
        this.executionTimeout = config.commandExecutionTimeout();
        this.allowDegraded = config.allowDispatchToDegraded();
    }

    /**
     * Pick up commands left unfinished by a previous hub run.
     * QUEUED commands are re-queued, SENT ones time out, ACKNOWLEDGED ones resume polling.
     */
    public void recover() {
        int resumed = 0;
        for (Spoke spoke : registry.list()) {
            for (Command command : repository.findActiveBySpoke(spoke.id())) {
                switch (command.state()) {
                    case QUEUED -> lane(spoke.id()).enqueue(command.id());
                    case SENT -> advance(command.id(), CommandState.TIMED_OUT,
                            "hub restarted while waiting for acknowledgment");
                    case ACKNOWLEDGED -> {
                        Instant since = command.updatedAt() != null ? command.updatedAt() : command.issuedAt();
                        schedulePoll(spoke.id(), command.id(), since.plus(executionTimeout));
                    }
                    default -> {
                    }
                }
                resumed++;
            }
            pump(spoke.id());
        }
        if (resumed > 0) {
            log.info("Recovered {} unfinished commands", resumed);
        }
    }

    /**
     * Validate and queue a command for delivery.
     *
     * @return the command in QUEUED state
     * @throws gamefleet.security.AuthException UNAUTHORIZED when the issuer may not use the verb
     * @throws FleetException INVALID_REQUEST, NOT_FOUND or SPOKE_UNREACHABLE; no row is written
     */
    public Command dispatch(DispatchRequest request, Principal issuer) {
        if (request == null || request.verb() == null) {
            throw FleetException.invalid("verb is required");
        }
        authorizer.authorize(issuer, request.verb());

        String instance = request.targetInstance();
        if (instance == null || !INSTANCE.matcher(instance).matches() || instance.startsWith(".")) {
            throw FleetException.invalid("targetInstance must match [A-Za-z0-9_.-]+");
        }
        String argument = null;
        if (request.verb() == CommandVerb.CUSTOM) {
            argument = request.argument();
            if (argument == null || !CUSTOM_ACTION.matcher(argument).matches()) {
                throw FleetException.invalid("CUSTOM requires an argument matching [a-z-]+");
            }
        }

        Spoke spoke = registry.get(request.spokeId());
        if (!spoke.status().acceptsCommands(allowDegraded)) {
            throw FleetException.unreachable("spoke " + spoke.id() + " is " + spoke.status());
        }

        Instant now = clock.instant();
        Command command = Command.builder()
                .id(UUID.randomUUID().toString())
                .spokeId(spoke.id())
                .verb(request.verb())
                .targetInstance(instance)
                .argument(argument)
                .issuedBy(issuer.name())
                .issuedAt(now)
                .state(CommandState.QUEUED)
                .updatedAt(now)
                .build();
        repository.insert(command);
        log.info("Command {} queued: {} {} on spoke {} by {}",
                command.id(), command.action(), instance, spoke.id(), issuer.name());

        lane(spoke.id()).enqueue(command.id());
        if (registry.find(spoke.id()).isEmpty()) {
            // spoke removed while the row was written; cancel what the removal pass missed
            onRemoved(spoke);
            return get(command.id());
        }
        pump(spoke.id());
        return command;
    }

    /**
     * @throws FleetException NOT_FOUND
     */
    public Command get(String commandId) {
        return repository.findById(commandId).orElseThrow(() -> FleetException.notFound("command", commandId));
    }

    public List<Command> history(String spokeId, int limit) {
        return repository.findBySpoke(spokeId, limit);
    }

    boolean hasLane(String spokeId) {
        return lanes.containsKey(spokeId);
    }

    /** Commands waiting behind the one in flight for this spoke. */
    public int queueDepth(String spokeId) {
        CommandLane lane = lanes.get(spokeId);
        return lane != null ? lane.depth() : 0;
    }

    @Override
    public void onRemoved(Spoke spoke) {
        CommandLane lane = lanes.remove(spoke.id());
        if (lane != null) {
            lane.drain();
        }
        int cancelled = 0;
        for (Command command : repository.findActiveBySpoke(spoke.id())) {
            if (advance(command.id(), CommandState.FAILED, "cancelled: spoke removed")) {
                cancelled++;
            }
        }
        if (cancelled > 0) {
            log.info("Cancelled {} commands of removed spoke {}", cancelled, spoke.id());
        }
    }

    private CommandLane lane(String spokeId) {
        return lanes.computeIfAbsent(spokeId, id -> new CommandLane());
    }

    private void pump(String spokeId) {
        CommandLane lane = lanes.get(spokeId);
        if (lane == null || closed) {
            return;
        }
        String next = lane.claimNext();
        if (next == null) {
            return;
        }
        try {
            outbound.execute(() -> deliver(spokeId, lane, next));
        } catch (RejectedExecutionException e) {
            log.error("Outbound pool rejected command {}", next);
            advance(next, CommandState.FAILED, "hub is shutting down");
            lane.release();
        }
    }

    private void deliver(String spokeId, CommandLane lane, String commandId) {
        try {
            Optional<Command> stored = repository.findById(commandId);
            if (stored.isEmpty() || stored.get().isTerminal()) {
                return;
            }
            Command command = stored.get();
            Optional<Spoke> spoke = registry.find(spokeId);
            if (spoke.isEmpty() || !spoke.get().status().acceptsCommands(allowDegraded)) {
                String status = spoke.map(s -> s.status().name()).orElse("removed");
                advance(commandId, CommandState.FAILED, "spoke_unreachable: spoke is " + status);
                return;
            }
            if (!advance(commandId, CommandState.SENT, null)) {
                return;
            }
            send(spoke.get(), command);
        } catch (RuntimeException e) {
            log.error("Delivery of command {} failed", commandId, e);
            advance(commandId, CommandState.FAILED, "internal error during delivery");
        } finally {
            lane.release();
            pump(spokeId);
        }
    }

    private void send(Spoke spoke, Command command) {
        try {
            CommandReport ack = client.sendCommand(spoke, command, ackTimeout);
            if (!advance(command.id(), CommandState.ACKNOWLEDGED, "accepted by spoke")) {
                return;
            }
            if (ack != null && ack.isFinished()) {
                complete(command.id(), ack);
            } else {
                schedulePoll(spoke.id(), command.id(), clock.instant().plus(executionTimeout));
            }
        } catch (SpokeCallException e) {
            if (e.reason() == SpokeCallException.Reason.REJECTED) {
                advance(command.id(), CommandState.FAILED,
                        "spoke rejected command (HTTP " + e.statusCode() + "): " + e.getMessage());
            } else {
                advance(command.id(), CommandState.TIMED_OUT, e.getMessage());
            }
        }
    }

    private void schedulePoll(String spokeId, String commandId, Instant deadline) {
        if (closed) {
            return;
        }
        try {
            pollScheduler.schedule(() -> submitPoll(spokeId, commandId, deadline),
                    pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Dispatcher closed, not polling command {}", commandId);
        }
    }

    private void submitPoll(String spokeId, String commandId, Instant deadline) {
        try {
            outbound.execute(() -> poll(spokeId, commandId, deadline));
        } catch (RejectedExecutionException e) {
            log.debug("Outbound pool closed, not polling command {}", commandId);
        }
    }

    private void poll(String spokeId, String commandId, Instant deadline) {
        try {
            Optional<Command> stored = repository.findById(commandId);
            if (stored.isEmpty() || stored.get().isTerminal()) {
                return;
            }
            Optional<Spoke> spoke = registry.find(spokeId);
            if (spoke.isEmpty()) {
                return;
            }
            if (clock.instant().isAfter(deadline)) {
                advance(commandId, CommandState.TIMED_OUT,
                        "no completion report within " + executionTimeout.toSeconds() + " s");
                return;
            }
            try {
                CommandReport report = client.commandStatus(spoke.get(), commandId, pollInterval.plus(ackTimeout));
                if (report.isFinished()) {
                    complete(commandId, report);
                    return;
                }
            } catch (SpokeCallException e) {
                if (e.reason() == SpokeCallException.Reason.REJECTED && e.statusCode() == 404) {
                    advance(commandId, CommandState.FAILED, "spoke has no record of the command");
                    return;
                }
                log.debug("Polling command {} failed: {}", commandId, e.getMessage());
            }
            schedulePoll(spokeId, commandId, deadline);
        } catch (RuntimeException e) {
            log.error("Polling command {} failed", commandId, e);
            schedulePoll(spokeId, commandId, deadline);
        }
    }

    private void complete(String commandId, CommandReport report) {
        CommandState outcome = CommandReport.SUCCEEDED.equals(report.state())
                ? CommandState.SUCCEEDED
                : CommandState.FAILED;
        StringBuilder detail = new StringBuilder("exit code ")
                .append(report.exitCode() != null ? report.exitCode() : "unknown");
        if (report.output() != null && !report.output().isBlank()) {
            detail.append('\n').append(report.output());
        }
        advance(commandId, outcome, detail.toString());
    }

    private boolean advance(String commandId, CommandState next, String detail) {
        String trimmed = detail != null && detail.length() > MAX_DETAIL
                ? detail.substring(detail.length() - MAX_DETAIL)
                : detail;
        boolean moved = repository.advance(commandId, next, trimmed, clock.instant());
        if (moved) {
            if (next == CommandState.FAILED || next == CommandState.TIMED_OUT) {
                log.warn("Command {} -> {}: {}", commandId, next, trimmed);
            } else {
                log.info("Command {} -> {}", commandId, next);
            }
        }
        return moved;
    }

    @Override
    public void close() {
        closed = true;
        pollScheduler.shutdownNow();
    }
}
