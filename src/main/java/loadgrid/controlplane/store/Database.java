package loadgrid.controlplane.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import loadgrid.controlplane.config.ControlPlaneConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management for the control-plane tables.
 * Uses HikariCP for connection pooling; connections are handed out with
 * auto-commit off so each repository call commits exactly one transaction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(ControlPlaneConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("loadgrid-db-pool");
        hikariConfig.setAutoCommit(false);

        // H2 specific settings
        if (jdbcUrl.contains("h2:")) {
            hikariConfig.addDataSourceProperty("MODE", "PostgreSQL");
        }

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

            // ---------- RUN STATUS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS run_status (
                            run_id             VARCHAR(64) PRIMARY KEY,
                            status             VARCHAR(20) NOT NULL,
                            phase              VARCHAR(20) NOT NULL,
                            scenario_config    CLOB,
                            workers_expected   INT DEFAULT 1,
                            workers_registered INT DEFAULT 0,
                            workers_active     INT DEFAULT 0,
                            workers_completed  INT DEFAULT 0,
                            start_time         TIMESTAMP,
                            end_time           TIMESTAMP,
                            failure_message    VARCHAR(2048),
                            summary            CLOB,
                            created_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- WORKER HEARTBEATS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_heartbeats (
                            run_id             VARCHAR(64) NOT NULL,
                            worker_id          VARCHAR(64) NOT NULL,
                            node_id            VARCHAR(128),
                            status             VARCHAR(20) NOT NULL,
                            phase              VARCHAR(20),
                            last_heartbeat     TIMESTAMP NOT NULL,
                            heartbeat_count    BIGINT DEFAULT 0,
                            active_connections INT DEFAULT 0,
                            target_connections INT DEFAULT 0,
                            queries_processed  BIGINT DEFAULT 0,
                            error_count        BIGINT DEFAULT 0,
                            last_error         VARCHAR(2048),
                            created_at         TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (run_id, worker_id)
                        );
                    """);

            // ---------- CONTROL EVENTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS control_events (
                            run_id      VARCHAR(64) NOT NULL,
                            sequence    BIGINT NOT NULL,
                            event_type  VARCHAR(20) NOT NULL,
                            event_data  CLOB NOT NULL,
                            created_at  TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (run_id, sequence)
                        );
                    """);

            // ---------- WORKER STEPS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_steps (
                            run_id          VARCHAR(64) NOT NULL,
                            worker_id       VARCHAR(64) NOT NULL,
                            step_index      INT NOT NULL,
                            concurrency     INT NOT NULL,
                            qps             DOUBLE,
                            p95_latency_ms  DOUBLE,
                            p99_latency_ms  DOUBLE,
                            error_rate_pct  DOUBLE,
                            stable          BOOLEAN NOT NULL,
                            stop_reason     VARCHAR(1024),
                            is_backoff      BOOLEAN DEFAULT FALSE,
                            kind_metrics    CLOB,
                            recorded_at     TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            PRIMARY KEY (run_id, worker_id, step_index)
                        );
                    """);

            // ---------- WORKER RESULTS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS worker_results (
                            run_id            VARCHAR(64) NOT NULL,
                            worker_id         VARCHAR(64) NOT NULL,
                            node_id           VARCHAR(128),
                            outcome           VARCHAR(20) NOT NULL,
                            total_operations  BIGINT DEFAULT 0,
                            total_errors      BIGINT DEFAULT 0,
                            error_message     VARCHAR(2048),
                            find_max          CLOB,
                            finished_at       TIMESTAMP,
                            PRIMARY KEY (run_id, worker_id)
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_run_status_status ON run_status(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_heartbeats_last ON worker_heartbeats(run_id, last_heartbeat);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new StoreException("Failed to initialize database schema", e);
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
