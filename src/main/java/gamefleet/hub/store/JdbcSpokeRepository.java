package gamefleet.hub.store;

import gamefleet.core.FleetException;
import gamefleet.hub.model.Spoke;
import gamefleet.hub.model.SpokeMetrics;
import gamefleet.hub.model.SpokeStatus;
import gamefleet.hub.repository.SpokeRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of SpokeRepository.
 */
public class JdbcSpokeRepository implements SpokeRepository {

    private final Database db;

    public JdbcSpokeRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Spoke spoke) {
        String sql = """
                    MERGE INTO spokes (id, name, address, api_key_hash, allowed_source_ip, status, last_seen,
                                       consecutive_failures, registered_at, registered_seq,
                                       cpu_percent, ram_percent, disk_percent, sessions)
                    KEY (id)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spoke.id());
            ps.setString(2, spoke.name());
            ps.setString(3, spoke.address());
            ps.setString(4, spoke.apiKeyHash());
            ps.setString(5, spoke.allowedSourceIp());
            ps.setString(6, spoke.status().name());
            Sql.setTimestamp(ps, 7, spoke.lastSeen());
            ps.setInt(8, spoke.consecutiveFailures());
            Sql.setTimestamp(ps, 9, spoke.registeredAt());
            ps.setLong(10, spoke.registrationSeq());
            SpokeMetrics metrics = spoke.lastMetrics();
            Sql.setDoubleOrNull(ps, 11, metrics != null ? metrics.cpuPercent() : null);
            Sql.setDoubleOrNull(ps, 12, metrics != null ? metrics.ramPercent() : null);
            Sql.setDoubleOrNull(ps, 13, metrics != null ? metrics.diskPercent() : null);
            ps.setString(14, metrics != null ? String.join(",", metrics.sessions()) : null);

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to save spoke: " + spoke.id(), e);
        }
    }

    @Override
    public Optional<Spoke> findById(String spokeId) {
        String sql = "SELECT * FROM spokes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spokeId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find spoke: " + spokeId, e);
        }
    }

    @Override
    public List<Spoke> findAll() {
        String sql = "SELECT * FROM spokes ORDER BY registered_seq";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<Spoke> result = new ArrayList<>();
            while (rs.next()) {
                result.add(mapRow(rs));
            }
            return result;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find all spokes", e);
        }
    }

    @Override
    public boolean delete(String spokeId) {
        String sql = "DELETE FROM spokes WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, spokeId);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to delete spoke: " + spokeId, e);
        }
    }

    @Override
    public long nextRegistrationSeq() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT NEXT VALUE FOR spoke_registration_seq")) {
            rs.next();
            long value = rs.getLong(1);
            conn.commit();
            return value;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to allocate registration sequence", e);
        }
    }

    private Spoke mapRow(ResultSet rs) throws SQLException {
        SpokeMetrics metrics = null;
        Double cpu = Sql.getDoubleOrNull(rs, "cpu_percent");
        if (cpu != null) {
            String sessions = rs.getString("sessions");
            metrics = new SpokeMetrics(
                    cpu,
                    rs.getDouble("ram_percent"),
                    rs.getDouble("disk_percent"),
                    sessions == null || sessions.isEmpty() ? List.of() : Arrays.asList(sessions.split(",")));
        }
        return Spoke.builder()
                .id(rs.getString("id"))
                .name(rs.getString("name"))
                .address(rs.getString("address"))
                .apiKeyHash(rs.getString("api_key_hash"))
                .allowedSourceIp(rs.getString("allowed_source_ip"))
                .status(SpokeStatus.valueOf(rs.getString("status")))
                .lastSeen(Sql.instant(rs, "last_seen"))
                .consecutiveFailures(rs.getInt("consecutive_failures"))
                .registeredAt(Sql.instant(rs, "registered_at"))
                .registrationSeq(rs.getLong("registered_seq"))
                .lastMetrics(metrics)
                .build();
    }
}
