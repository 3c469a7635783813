package gamefleet.hub.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import gamefleet.hub.config.HubConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(HubConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("gamefleet-db-pool");
        hikariConfig.setAutoCommit(false);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool initialized: {}", jdbcUrl);

        initSchema();
    }

    /**
     * Get a connection from the pool.
     * Caller is responsible for closing the connection.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    public DataSource getDataSource() {
        return dataSource;
    }

    /**
     * Check if database is healthy.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- SPOKES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS spokes (
                            id                   VARCHAR(64) PRIMARY KEY,
                            name                 VARCHAR(128) NOT NULL,
                            address              VARCHAR(512) NOT NULL,
                            api_key_hash         VARCHAR(64) NOT NULL,
                            allowed_source_ip    VARCHAR(64),
                            status               VARCHAR(20) DEFAULT 'PENDING',
                            last_seen            TIMESTAMP,
                            consecutive_failures INT DEFAULT 0,
                            registered_at        TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            registered_seq       BIGINT NOT NULL,
                            cpu_percent          DOUBLE,
                            ram_percent          DOUBLE,
                            disk_percent         DOUBLE,
                            sessions             VARCHAR(2048)
                        );
                    """);
            st.addBatch("CREATE SEQUENCE IF NOT EXISTS spoke_registration_seq START WITH 1;");

            // ---------- COMMANDS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS commands (
                            id              VARCHAR(64) PRIMARY KEY,
                            spoke_id        VARCHAR(64) NOT NULL,
                            verb            VARCHAR(20) NOT NULL,
                            target_instance VARCHAR(128) NOT NULL,
                            argument        VARCHAR(128),
                            issued_by       VARCHAR(128),
                            issued_at       TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            state           VARCHAR(20) DEFAULT 'QUEUED',
                            result_detail   CLOB,
                            updated_at      TIMESTAMP
                        );
                    """);

            // ---------- USERS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS users (
                            username            VARCHAR(64) PRIMARY KEY,
                            password_hash       VARCHAR(256) NOT NULL,
                            role                VARCHAR(20) NOT NULL,
                            created_at          TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            password_changed_at TIMESTAMP
                        );
                    """);

            // ---------- SETTINGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS settings (
                            setting_key   VARCHAR(128) PRIMARY KEY,
                            setting_value VARCHAR(2048)
                        );
                    """);

            // ---------- TRANSITIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS transitions (
                            id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            spoke_id    VARCHAR(64) NOT NULL,
                            spoke_name  VARCHAR(128),
                            from_status VARCHAR(20) NOT NULL,
                            to_status   VARCHAR(20) NOT NULL,
                            occurred_at TIMESTAMP NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_commands_spoke_issued ON commands(spoke_id, issued_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_commands_spoke_state ON commands(spoke_id, state);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_transitions_spoke ON transitions(spoke_id, occurred_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_spokes_seq ON spokes(registered_seq);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize database schema", e);
        }
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            dataSource.close();
            log.info("Database pool closed");
        }
    }
}
