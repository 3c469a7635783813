package gamefleet.spoke.exec;

import gamefleet.core.ErrorKind;
import gamefleet.core.FleetException;
import gamefleet.protocol.CommandReport;
import gamefleet.protocol.CommandRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Duration;
import java.util.Set;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class CommandExecutorTest {

    @TempDir
    Path home;

    private CommandExecutor executor;

    @BeforeEach
    void setUp() throws IOException {
        script("vhserver", """
                #!/bin/sh
                echo "$1" >> runs.txt
                echo "[ OK ] $1 vhserver"
                """);
        script("broken", """
                #!/bin/sh
                echo "Error! no config" >&2
                exit 3
                """);
        script("slow", """
                #!/bin/sh
                echo "starting"
                sleep 30
                """);
        executor = new CommandExecutor(new ScriptRunner(home, Duration.ofSeconds(1)),
                Set.of("start", "stop", "details"), 2);
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private void script(String name, String body) throws IOException {
        Path file = home.resolve(name);
        Files.writeString(file, body);
        Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rwxr-xr-x"));
    }

    private CommandReport awaitFinished(String commandId) {
        await().atMost(Duration.ofSeconds(10))
                .until(() -> executor.report(commandId).map(CommandReport::isFinished).orElse(false));
        return executor.report(commandId).orElseThrow();
    }

    @Test
    void runsScriptAndReportsSuccess() {
        CommandReport accepted = executor.submit(new CommandRequest("c-1", "vhserver", "start"));
        assertEquals("c-1", accepted.commandId());

        CommandReport done = awaitFinished("c-1");
        assertEquals(CommandReport.SUCCEEDED, done.state());
        assertEquals(0, done.exitCode());
        assertTrue(done.output().contains("[ OK ] start vhserver"), done.output());
    }

    @Test
    void nonZeroExitIsFailureWithStderr() {
        executor.submit(new CommandRequest("c-2", "broken", "stop"));

        CommandReport done = awaitFinished("c-2");
        assertEquals(CommandReport.FAILED, done.state());
        assertEquals(3, done.exitCode());
        assertTrue(done.output().contains("Error! no config"));
    }

    @Test
    void overrunningScriptIsKilled() {
        executor.submit(new CommandRequest("c-3", "slow", "start"));

        CommandReport done = awaitFinished("c-3");
        assertEquals(CommandReport.FAILED, done.state());
        assertEquals(-1, done.exitCode());
        assertTrue(done.output().contains("killed after 1s"), done.output());
    }

    @Test
    void repeatedIdDoesNotRunTwice() throws IOException {
        executor.submit(new CommandRequest("c-4", "vhserver", "start"));
        awaitFinished("c-4");
        CommandReport again = executor.submit(new CommandRequest("c-4", "vhserver", "start"));

        assertEquals(CommandReport.SUCCEEDED, again.state());
        assertEquals(1, Files.readAllLines(home.resolve("runs.txt")).size());
    }

    @Test
    void rejectsBadRequests() {
        FleetException action = assertThrows(FleetException.class,
                () -> executor.submit(new CommandRequest("c-5", "vhserver", "update")));
        assertEquals(ErrorKind.INVALID_REQUEST, action.kind());

        FleetException missing = assertThrows(FleetException.class,
                () -> executor.submit(new CommandRequest("c-6", "csgoserver", "start")));
        assertEquals(ErrorKind.NOT_FOUND, missing.kind());

        assertThrows(FleetException.class, () -> executor.submit(new CommandRequest("c-7", "../vhserver", "start")));
        assertThrows(FleetException.class, () -> executor.submit(new CommandRequest("c 8", "vhserver", "start")));
        assertTrue(executor.report("c-5").isEmpty());
    }

    @Test
    void forgetsOldestFinishedCommandsBeyondRetention() {
        for (String id : new String[] {"r-1", "r-2", "r-3"}) {
            executor.submit(new CommandRequest(id, "vhserver", "details"));
            awaitFinished(id);
        }

        assertTrue(executor.report("r-1").isEmpty());
        assertTrue(executor.report("r-2").isPresent());
        assertTrue(executor.report("r-3").isPresent());
    }
}
