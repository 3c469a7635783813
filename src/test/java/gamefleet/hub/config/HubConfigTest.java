package gamefleet.hub.config;

import org.ini4j.Ini;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HubConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        HubConfig config = HubConfig.defaults().validate();
        assertEquals(8080, config.serverPort());
        assertEquals(Duration.ofSeconds(60), config.heartbeatInterval());
        assertEquals(Duration.ofSeconds(5), config.heartbeatJitter());
        assertEquals(Duration.ofSeconds(5), config.heartbeatTimeout());
        assertEquals(2, config.degradedThreshold());
        assertEquals(3, config.offlineThreshold());
        assertEquals(Duration.ofMinutes(3), config.graceWindow());
        assertTrue(config.allowDispatchToDegraded());
        assertNull(config.provisioningToken());
    }

    @Test
    void iniOverridesDefaults() throws Exception {
        String ini = """
                [server]
                port = 9090

                [security]
                token_secret = 0123456789abcdef-secret
                provisioning_token = install-me
                max_clock_skew = PT2M

                [heartbeat]
                interval = 30
                degraded_after = 3
                offline_after = 6

                [commands]
                allow_degraded = false
                execution_timeout = PT5M
                """;
        HubConfig config = HubConfig.defaults();
        config.applyIni(new Ini(new StringReader(ini)));

        assertEquals(9090, config.serverPort());
        assertEquals("0123456789abcdef-secret", config.tokenSecret());
        assertEquals("install-me", config.provisioningToken());
        assertEquals(Duration.ofMinutes(2), config.maxClockSkew());
        assertEquals(Duration.ofSeconds(30), config.heartbeatInterval());
        assertEquals(3, config.degradedThreshold());
        assertEquals(6, config.offlineThreshold());
        assertFalse(config.allowDispatchToDegraded());
        assertEquals(Duration.ofMinutes(5), config.commandExecutionTimeout());
        assertEquals(Duration.ofSeconds(5), config.heartbeatJitter());
    }

    @Test
    void environmentWinsOverIni() throws Exception {
        HubConfig config = HubConfig.defaults();
        config.applyIni(new Ini(new StringReader("[server]\nport = 9090\n")));
        config.applyEnv(Map.of(
                "GAMEFLEET_PORT", "7000",
                "GAMEFLEET_SECRET_KEY", "from-the-environment",
                "GAMEFLEET_HEARTBEAT_SECONDS", "15",
                "GAMEFLEET_ALLOW_DEGRADED_DISPATCH", "false",
                "GAMEFLEET_ADMIN_PASSWORD", " "));

        assertEquals(7000, config.serverPort());
        assertEquals("from-the-environment", config.tokenSecret());
        assertEquals(Duration.ofSeconds(15), config.heartbeatInterval());
        assertFalse(config.allowDispatchToDegraded());
        assertNull(config.adminPassword());
    }

    @Test
    void loadReadsFileWhenPresent(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("gamefleet.ini");
        Files.writeString(file, "[logs]\nreplay_lines = 250\n");

        assertEquals(250, HubConfig.load(file).logReplayLines());
        assertEquals(100, HubConfig.load(dir.resolve("missing.ini")).logReplayLines());
    }

    @Test
    void rejectsContradictoryThresholds() {
        assertThrows(IllegalStateException.class, () -> HubConfig.defaults().withThresholds(3, 3).validate());
        assertThrows(IllegalStateException.class, () -> HubConfig.defaults().withThresholds(0, 2).validate());
        assertThrows(IllegalStateException.class, () -> HubConfig.defaults()
                .withHeartbeatInterval(Duration.ofSeconds(5))
                .withHeartbeatTimeout(Duration.ofSeconds(5))
                .validate());
    }
}
