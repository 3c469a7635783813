package gamefleet.hub.store;

import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DatabaseTest {

    @TempDir
    Path dir;

    private String fileUrl() {
        return "jdbc:h2:file:" + dir.resolve("gamefleet").toAbsolutePath()
                + ";MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    @Test
    void schemaInitializesInPostgresModeAndSurvivesReopen() {
        Instant at = Instant.parse("2026-03-01T10:00:00Z");
        try (Database db = new Database(fileUrl(), 2)) {
            assertTrue(db.isHealthy());
            JdbcTransitionRepository transitions = new JdbcTransitionRepository(db);
            transitions.append(new TransitionEvent("s1", "S1", SpokeStatus.PENDING, SpokeStatus.ONLINE, at));
            transitions.append(new TransitionEvent("s1", "S1", SpokeStatus.ONLINE, SpokeStatus.DEGRADED,
                    at.plusSeconds(60)));
        }

        try (Database reopened = new Database(fileUrl(), 2)) {
            List<TransitionEvent> stored = new JdbcTransitionRepository(reopened).findBySpoke("s1", 10);
            assertEquals(2, stored.size());
            assertEquals(SpokeStatus.DEGRADED, stored.get(0).to());
            assertEquals(SpokeStatus.ONLINE, stored.get(1).to());
        }
    }
}
