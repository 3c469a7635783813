package gamefleet.spoke.exec;

import gamefleet.core.FleetException;
import gamefleet.core.Threads;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.CommandRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Accepts commands from the hub, runs them in the background and remembers their outcome.
 *
 * Submission is idempotent by command id: a repeated id returns the existing
 * execution's report and does not run the script again. Finished entries beyond
 * the retention limit are forgotten oldest first.
 */
public final class CommandExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CommandExecutor.class);

    private static final Pattern INSTANCE = Pattern.compile("[A-Za-z0-9_.-]+");
    private static final Pattern COMMAND_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ScriptRunner runner;
    private final Set<String> allowedActions;
    private final int retention;
    private final ExecutorService workers = Executors.newFixedThreadPool(4, Threads.daemon("gamefleet-script"));

    private final Map<String, Execution> ledger = new LinkedHashMap<>();

    public CommandExecutor(ScriptRunner runner, Set<String> allowedActions, int retention) {
        this.runner = runner;
        this.allowedActions = Set.copyOf(allowedActions);
        this.retention = retention;
    }

    /**
     * @return the RUNNING report of a new execution, or the current report of a repeated id
     * @throws FleetException INVALID_REQUEST for a disallowed action or malformed ids,
     *                        NOT_FOUND when the instance script does not exist
     */
    public CommandReport submit(CommandRequest request) {
        if (request == null || request.commandId() == null || !COMMAND_ID.matcher(request.commandId()).matches()) {
            throw FleetException.invalid("commandId is required");
        }
        synchronized (ledger) {
            Execution existing = ledger.get(request.commandId());
            if (existing != null) {
                log.debug("Command {} already known, not executing again", request.commandId());
                return existing.report();
            }
        }
        String action = request.action();
        if (action == null || !allowedActions.contains(action)) {
            throw FleetException.invalid("action not allowed: " + action);
        }
        String instance = request.instance();
        if (instance == null || !INSTANCE.matcher(instance).matches() || instance.startsWith(".")) {
            throw FleetException.invalid("instance must match [A-Za-z0-9_.-]+");
        }
        if (!runner.scriptExists(instance)) {
            throw FleetException.notFound("instance script", instance);
        }

        Execution execution;
        synchronized (ledger) {
            Execution existing = ledger.get(request.commandId());
            if (existing != null) {
                return existing.report();
            }
            execution = new Execution(request.commandId());
            ledger.put(request.commandId(), execution);
            evictFinished();
        }
        try {
            workers.execute(() -> execute(execution, instance, action));
        } catch (RejectedExecutionException e) {
            execution.finish(-1, "agent shutting down");
        }
        return execution.report();
    }

    public Optional<CommandReport> report(String commandId) {
        synchronized (ledger) {
            return Optional.ofNullable(ledger.get(commandId)).map(Execution::report);
        }
    }

    private void execute(Execution execution, String instance, String action) {
        try {
            ScriptRunner.Result result = runner.run(instance, action);
            execution.finish(result.timedOut() ? -1 : result.exitCode(), result.output());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            execution.finish(-1, "interrupted");
        } catch (Exception e) {
            log.warn("Command {} could not run: {}", execution.commandId, e.getMessage());
            execution.finish(-1, "failed to start: " + e.getMessage());
        }
    }

    private void evictFinished() {
        int excess = ledger.size() - retention;
        Iterator<Execution> it = ledger.values().iterator();
        while (excess > 0 && it.hasNext()) {
            if (it.next().isFinished()) {
                it.remove();
                excess--;
            }
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static final class Execution {

        private final String commandId;
        private volatile Integer exitCode;
        private volatile String output = "";

        Execution(String commandId) {
            this.commandId = commandId;
        }

        void finish(int code, String out) {
            this.output = out;
            this.exitCode = code;
        }

        boolean isFinished() {
            return exitCode != null;
        }

        CommandReport report() {
            Integer code = exitCode;
            if (code == null) {
                return new CommandReport(commandId, CommandReport.RUNNING, null, "");
            }
            return new CommandReport(commandId,
                    code == 0 ? CommandReport.SUCCEEDED : CommandReport.FAILED, code, output);
        }
    }
}
