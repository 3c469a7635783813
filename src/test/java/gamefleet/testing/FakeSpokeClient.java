package gamefleet.testing;

import gamefleet.hub.client.SpokeCallException;
import gamefleet.hub.client.SpokeClient;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.Spoke;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.StatusReport;
import gamefleet.protocol.TelemetryReport;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scriptable spoke client. Spokes are reachable and commands keep running unless told otherwise.
 */
public final class FakeSpokeClient implements SpokeClient {

    @FunctionalInterface
    public interface SendBehavior {
        CommandReport send(Spoke spoke, Command command) throws SpokeCallException;
    }

    private final Set<String> unreachable = ConcurrentHashMap.newKeySet();
    private final Map<String, AtomicInteger> statusCalls = new ConcurrentHashMap<>();
    private final Map<String, CommandReport> reports = new ConcurrentHashMap<>();
    private final Set<String> forgotten = ConcurrentHashMap.newKeySet();
    private final List<Command> sent = new CopyOnWriteArrayList<>();
    private volatile SendBehavior sendBehavior =
            (spoke, command) -> new CommandReport(command.id(), CommandReport.RUNNING, null, "");

    public void setReachable(String spokeId, boolean reachable) {
        if (reachable) {
            unreachable.remove(spokeId);
        } else {
            unreachable.add(spokeId);
        }
    }

    public int statusCalls(String spokeId) {
        AtomicInteger count = statusCalls.get(spokeId);
        return count == null ? 0 : count.get();
    }

    public void onSend(SendBehavior behavior) {
        this.sendBehavior = behavior;
    }

    public void finish(String commandId, int exitCode, String output) {
        reports.put(commandId, new CommandReport(commandId,
                exitCode == 0 ? CommandReport.SUCCEEDED : CommandReport.FAILED, exitCode, output));
    }

    /** Later status polls for this command answer 404. */
    public void forget(String commandId) {
        forgotten.add(commandId);
    }

    public List<Command> sent() {
        return List.copyOf(sent);
    }

    @Override
    public StatusReport status(Spoke spoke, Duration timeout) throws SpokeCallException {
        statusCalls.computeIfAbsent(spoke.id(), k -> new AtomicInteger()).incrementAndGet();
        if (unreachable.contains(spoke.id())) {
            throw new SpokeCallException(SpokeCallException.Reason.TIMEOUT, "timed out", null);
        }
        return new StatusReport("online", List.of("vhserver"), new TelemetryReport(12.5, 40, 55));
    }

    @Override
    public CommandReport sendCommand(Spoke spoke, Command command, Duration timeout) throws SpokeCallException {
        sent.add(command);
        if (unreachable.contains(spoke.id())) {
            throw new SpokeCallException(SpokeCallException.Reason.CONNECTION, "connection refused", null);
        }
        return sendBehavior.send(spoke, command);
    }

    @Override
    public CommandReport commandStatus(Spoke spoke, String commandId, Duration timeout) throws SpokeCallException {
        if (forgotten.contains(commandId)) {
            throw new SpokeCallException(404, "command not found");
        }
        return reports.getOrDefault(commandId, new CommandReport(commandId, CommandReport.RUNNING, null, ""));
    }
}
