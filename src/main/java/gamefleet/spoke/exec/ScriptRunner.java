package gamefleet.spoke.exec;

import gamefleet.core.Threads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

/**
 * Runs {@code ./<instance> <action>} inside the LinuxGSM home directory and
 * captures the tail of its combined output.
 */
public class ScriptRunner {

    private static final Logger log = LoggerFactory.getLogger(ScriptRunner.class);

    public static final int OUTPUT_LIMIT = 4096;

    private final Path workingDir;
    private final Duration timeout;
    private final ThreadFactory readers = Threads.daemon("gamefleet-script-output");

    public record Result(int exitCode, String output, boolean timedOut) {
    }

    public ScriptRunner(Path workingDir, Duration timeout) {
        this.workingDir = workingDir;
        this.timeout = timeout;
    }

    /**
     * Whether the instance script exists in the working directory.
     */
    public boolean scriptExists(String instance) {
        if (instance.indexOf('/') >= 0 || instance.indexOf('\\') >= 0) {
            return false;
        }
        Path script = workingDir.resolve(instance).normalize();
        return script.getParent() != null
                && script.getParent().equals(workingDir.normalize())
                && Files.isRegularFile(script);
    }

    /**
     * Run the script and wait for it, up to the configured timeout.
     *
     * @throws IOException when the process cannot be started
     */
    public Result run(String instance, String action) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(List.of("./" + instance, action));
        builder.directory(workingDir.toFile());
        builder.redirectErrorStream(true);

        log.info("Running ./{} {} in {}", instance, action, workingDir);
        Process process = builder.start();
        process.getOutputStream().close();

        OutputTail tail = new OutputTail(OUTPUT_LIMIT);
        Thread reader = readers.newThread(() -> capture(process, tail));
        reader.start();

        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            log.warn("./{} {} exceeded {}, killing PID {}", instance, action, timeout, process.pid());
            process.destroyForcibly();
            process.waitFor(5, TimeUnit.SECONDS);
        }
        reader.join(2000);

        int exitCode = finished ? process.exitValue() : -1;
        String output = tail.toString();
        if (!finished) {
            output = output + "killed after " + timeout.toSeconds() + "s\n";
        }
        log.info("./{} {} finished with exit code {}", instance, action, exitCode);
        return new Result(exitCode, output, !finished);
    }

    private static void capture(Process process, OutputTail tail) {
        try (BufferedReader in = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                tail.appendLine(line);
            }
        } catch (IOException e) {
            log.debug("Output capture ended: {}", e.getMessage());
        }
    }
}
