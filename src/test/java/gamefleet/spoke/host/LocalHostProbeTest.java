package gamefleet.spoke.host;

import gamefleet.protocol.TelemetryReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LocalHostProbeTest {

    @Test
    void parsesTmuxListing() {
        List<String> lines = List.of(
                "vhserver: 1 windows (created Sat Oct 17 10:00:00 2026)",
                "csgoserver-2: 1 windows (created Sat Oct 17 11:00:00 2026) (attached)",
                "",
                "  ");

        assertEquals(List.of("vhserver", "csgoserver-2"), LocalHostProbe.parseSessions(lines));
    }

    @Test
    void telemetryIsInPercentRange(@TempDir Path dir) {
        TelemetryReport report = new LocalHostProbe(dir.toFile()).telemetry();

        for (double value : new double[] {report.cpu(), report.ram(), report.disk()}) {
            assertTrue(value >= 0 && value <= 100, "out of range: " + value);
        }
    }
}
