package gamefleet.spoke.host;

import gamefleet.protocol.TelemetryReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Reads sessions from {@code tmux ls} and usage from the JVM's view of the OS.
 */
public final class LocalHostProbe implements HostProbe {

    private static final Logger log = LoggerFactory.getLogger(LocalHostProbe.class);

    private final File diskRoot;

    public LocalHostProbe(File diskRoot) {
        this.diskRoot = diskRoot;
    }

    @Override
    public List<String> sessions() {
        ProcessBuilder builder = new ProcessBuilder("tmux", "ls");
        builder.redirectErrorStream(true);
        try {
            Process process = builder.start();
            List<String> lines = new ArrayList<>();
            try (BufferedReader in = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = in.readLine()) != null) {
                    lines.add(line);
                }
            }
            if (!process.waitFor(3, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                return List.of();
            }
            // non-zero when no server is running
            return process.exitValue() == 0 ? parseSessions(lines) : List.of();
        } catch (IOException e) {
            log.debug("tmux unavailable: {}", e.getMessage());
            return List.of();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return List.of();
        }
    }

    /** {@code name: 1 windows (created ...)} to {@code name}. */
    static List<String> parseSessions(List<String> lines) {
        List<String> names = new ArrayList<>();
        for (String line : lines) {
            int colon = line.indexOf(':');
            String name = (colon > 0 ? line.substring(0, colon) : line).trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names;
    }

    @Override
    public TelemetryReport telemetry() {
        double cpu = 0;
        double ram = 0;
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            double load = os.getCpuLoad();
            cpu = load < 0 ? 0 : load * 100;
            long total = os.getTotalMemorySize();
            if (total > 0) {
                ram = 100.0 * (total - os.getFreeMemorySize()) / total;
            }
        }
        double disk = 0;
        long totalSpace = diskRoot.getTotalSpace();
        if (totalSpace > 0) {
            disk = 100.0 * (totalSpace - diskRoot.getUsableSpace()) / totalSpace;
        }
        return new TelemetryReport(round(cpu), round(ram), round(disk));
    }

    private static double round(double percent) {
        return Math.round(percent * 10) / 10.0;
    }
}
