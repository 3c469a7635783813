package gamefleet.hub.store;

import gamefleet.core.FleetException;
import gamefleet.hub.model.Command;
import gamefleet.hub.model.CommandState;
import gamefleet.hub.model.CommandVerb;
import gamefleet.hub.repository.CommandRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * JDBC implementation of CommandRepository.
 * State updates are conditional on the stored state so a command never moves backward.
 */
public class JdbcCommandRepository implements CommandRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCommandRepository.class);

    private final Database db;

    public JdbcCommandRepository(Database db) {
        this.db = db;
    }

    @Override
    public void insert(Command command) {
        String sql = """
                    INSERT INTO commands (id, spoke_id, verb, target_instance, argument, issued_by,
                                          issued_at, state, result_detail, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, command.id());
            ps.setString(2, command.spokeId());
            ps.setString(3, command.verb().name());
            ps.setString(4, command.targetInstance());
            ps.setString(5, command.argument());
            ps.setString(6, command.issuedBy());
            Sql.setTimestamp(ps, 7, command.issuedAt());
            ps.setString(8, command.state().name());
            ps.setString(9, command.resultDetail());
            Sql.setTimestamp(ps, 10, command.updatedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to insert command: " + command.id(), e);
        }
    }

    @Override
    public Optional<Command> findById(String commandId) {
        String sql = "SELECT * FROM commands WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, commandId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find command: " + commandId, e);
        }
    }

    @Override
    public List<Command> findBySpoke(String spokeId, int limit) {
        String sql = "SELECT * FROM commands WHERE spoke_id = ? ORDER BY issued_at DESC, id LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spokeId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find commands for spoke: " + spokeId, e);
        }
    }

    @Override
    public List<Command> findActiveBySpoke(String spokeId) {
        String sql = """
                    SELECT * FROM commands
                    WHERE spoke_id = ? AND state IN ('QUEUED', 'SENT', 'ACKNOWLEDGED')
                    ORDER BY issued_at, id
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spokeId);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find active commands for spoke: " + spokeId, e);
        }
    }

    @Override
    public boolean advance(String commandId, CommandState next, String detail, Instant at) {
        Set<CommandState> from = CommandState.predecessorsOf(next);
        if (from.isEmpty()) {
            return false;
        }
        String inList = from.stream().map(s -> "'" + s.name() + "'").collect(Collectors.joining(", "));
        String sql = "UPDATE commands SET state = ?, result_detail = COALESCE(?, result_detail), updated_at = ? "
                + "WHERE id = ? AND state IN (" + inList + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, next.name());
            ps.setString(2, detail);
            Sql.setTimestamp(ps, 3, at);
            ps.setString(4, commandId);

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated == 0) {
                log.debug("Command {} not advanced to {} (state no longer allows it)", commandId, next);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to advance command: " + commandId, e);
        }
    }

    private List<Command> mapRows(ResultSet rs) throws SQLException {
        List<Command> result = new ArrayList<>();
        while (rs.next()) {
            result.add(mapRow(rs));
        }
        return result;
    }

    private Command mapRow(ResultSet rs) throws SQLException {
        return Command.builder()
                .id(rs.getString("id"))
                .spokeId(rs.getString("spoke_id"))
                .verb(CommandVerb.valueOf(rs.getString("verb")))
                .targetInstance(rs.getString("target_instance"))
                .argument(rs.getString("argument"))
                .issuedBy(rs.getString("issued_by"))
                .issuedAt(Sql.instant(rs, "issued_at"))
                .state(CommandState.valueOf(rs.getString("state")))
                .resultDetail(rs.getString("result_detail"))
                .updatedAt(Sql.instant(rs, "updated_at"))
                .build();
    }
}
