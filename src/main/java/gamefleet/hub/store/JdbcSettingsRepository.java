package gamefleet.hub.store;

import gamefleet.core.FleetException;
import gamefleet.hub.repository.SettingsRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * JDBC implementation of SettingsRepository.
 */
public class JdbcSettingsRepository implements SettingsRepository {

    private final Database db;

    public JdbcSettingsRepository(Database db) {
        this.db = db;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT setting_value FROM settings WHERE setting_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw FleetException.storage("Failed to read setting: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        String sql = "MERGE INTO settings (setting_key, setting_value) KEY (setting_key) VALUES (?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to write setting: " + key, e);
        }
    }

    @Override
    public void remove(String key) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement("DELETE FROM settings WHERE setting_key = ?")) {

            ps.setString(1, key);
            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw FleetException.storage("Failed to remove setting: " + key, e);
        }
    }
}
