package gamefleet.hub.store;

import gamefleet.core.FleetException;
import gamefleet.hub.model.DashboardUser;
import gamefleet.hub.repository.UserRepository;
import gamefleet.security.Role;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of UserRepository.
 */
public class JdbcUserRepository implements UserRepository {

    private final Database db;

    public JdbcUserRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(DashboardUser user) {
        String sql = """
                    MERGE INTO users (username, password_hash, role, created_at, password_changed_at)
                    KEY (username)
                    VALUES (?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, user.username());
            ps.setString(2, user.passwordHash());
            ps.setString(3, user.role().name());
            Sql.setTimestamp(ps, 4, user.createdAt());
            Sql.setTimestamp(ps, 5, user.passwordChangedAt());

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to save user: " + user.username(), e);
        }
    }

    @Override
    public Optional<DashboardUser> findByUsername(String username) {
        String sql = "SELECT * FROM users WHERE username = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, username);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to find user: " + username, e);
        }
    }

    @Override
    public List<DashboardUser> findAll() {
        String sql = "SELECT * FROM users ORDER BY username";

        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {

            List<DashboardUser> result = new ArrayList<>();
            while (rs.next()) {
                result.add(mapRow(rs));
            }
            return result;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to list users", e);
        }
    }

    @Override
    public boolean delete(String username) {
        String sql = "DELETE FROM users WHERE username = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, username);
            int deleted = ps.executeUpdate();
            conn.commit();
            return deleted > 0;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to delete user: " + username, e);
        }
    }

    @Override
    public int count() {
        try (Connection conn = db.getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM users")) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw FleetException.storage("Failed to count users", e);
        }
    }

    private DashboardUser mapRow(ResultSet rs) throws SQLException {
        return new DashboardUser(
                rs.getString("username"),
                rs.getString("password_hash"),
                Role.valueOf(rs.getString("role")),
                Sql.instant(rs, "created_at"),
                Sql.instant(rs, "password_changed_at"));
    }
}
