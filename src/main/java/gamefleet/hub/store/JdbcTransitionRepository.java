package gamefleet.hub.store;

import gamefleet.core.FleetException;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.model.TransitionEvent;
import gamefleet.hub.repository.TransitionRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC implementation of TransitionRepository.
 */
public class JdbcTransitionRepository implements TransitionRepository {

    private final Database db;

    public JdbcTransitionRepository(Database db) {
        this.db = db;
    }

    @Override
    public void append(TransitionEvent event) {
        String sql = """
                    INSERT INTO transitions (spoke_id, spoke_name, from_status, to_status, occurred_at)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, event.spokeId());
            ps.setString(2, event.spokeName());
            ps.setString(3, event.from().name());
            ps.setString(4, event.to().name());
            Sql.setTimestamp(ps, 5, event.timestamp());
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to record transition for spoke: " + event.spokeId(), e);
        }
    }

    @Override
    public List<TransitionEvent> findBySpoke(String spokeId, int limit) {
        String sql = "SELECT * FROM transitions WHERE spoke_id = ? ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spokeId);
            ps.setInt(2, limit);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find transitions for spoke: " + spokeId, e);
        }
    }

    @Override
    public List<TransitionEvent> findRecent(int limit) {
        String sql = "SELECT * FROM transitions ORDER BY id DESC LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                return mapRows(rs);
            }
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find recent transitions", e);
        }
    }

    private List<TransitionEvent> mapRows(ResultSet rs) throws SQLException {
        List<TransitionEvent> result = new ArrayList<>();
        while (rs.next()) {
            result.add(new TransitionEvent(
                    rs.getString("spoke_id"),
                    rs.getString("spoke_name"),
                    SpokeStatus.valueOf(rs.getString("from_status")),
                    SpokeStatus.valueOf(rs.getString("to_status")),
                    Sql.instant(rs, "occurred_at")));
        }
        return result;
    }
}
