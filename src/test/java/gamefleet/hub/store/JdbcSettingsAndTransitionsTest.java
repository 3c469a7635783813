package gamefleet.hub.store;

import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.testing.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class JdbcSettingsAndTransitionsTest {

    private Database db;

    @BeforeEach
    void setUp() {
        db = TestDatabases.create("settings");
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    @Test
    void settingsUpsertAndRemove() {
        JdbcSettingsRepository settings = new JdbcSettingsRepository(db);
        assertEquals(Optional.empty(), settings.get("discord_webhook"));

        settings.put("discord_webhook", "https://discord.example/api/webhooks/1/a");
        settings.put("discord_webhook", "https://discord.example/api/webhooks/2/b");
        assertEquals(Optional.of("https://discord.example/api/webhooks/2/b"), settings.get("discord_webhook"));

        settings.remove("discord_webhook");
        assertEquals(Optional.empty(), settings.get("discord_webhook"));
    }

    @Test
    void transitionsAreNewestFirst() {
        JdbcTransitionRepository transitions = new JdbcTransitionRepository(db);
        Instant t0 = Instant.parse("2026-03-01T10:00:00Z");
        transitions.append(new TransitionEvent("s1", "S1", SpokeStatus.PENDING, SpokeStatus.ONLINE, t0));
        transitions.append(new TransitionEvent("s2", "S2", SpokeStatus.PENDING, SpokeStatus.ONLINE, t0));
        transitions.append(new TransitionEvent("s1", "S1", SpokeStatus.ONLINE, SpokeStatus.DEGRADED,
                t0.plusSeconds(120)));

        List<TransitionEvent> s1 = transitions.findBySpoke("s1", 10);
        assertEquals(2, s1.size());
        assertEquals(SpokeStatus.DEGRADED, s1.get(0).to());
        assertEquals(t0.plusSeconds(120), s1.get(0).timestamp());
        assertEquals("S1", s1.get(0).spokeName());

        assertEquals(2, transitions.findRecent(2).size());
        assertEquals("s1", transitions.findRecent(1).get(0).spokeId());
    }
}
