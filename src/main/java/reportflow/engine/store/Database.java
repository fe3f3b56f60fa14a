package reportflow.engine.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import reportflow.engine.config.EngineConfig;
import reportflow.engine.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * HikariCP pool for the job store or the reporting source.
 *
 * The job store pool owns the {@code jobs}, {@code runs} and {@code notifications}
 * tables. A reporting source pool ({@link #forSource}) is read-only and never
 * touches the schema.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(EngineConfig config) {
        this(config.databaseUrl(), config.databasePoolSize(), "reportflow-db-pool", false);
        initSchema();
    }

    private Database(String jdbcUrl, int poolSize, String poolName, boolean readOnly) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName(poolName);
        hikariConfig.setAutoCommit(false);
        hikariConfig.setReadOnly(readOnly);

        this.dataSource = new HikariDataSource(hikariConfig);

        log.info("Database pool {} initialized: {}", poolName, jdbcUrl);
    }

    /**
     * Read-only pool for the data source report queries run against.
     */
    public static Database forSource(String jdbcUrl, int poolSize) {
        return new Database(jdbcUrl, poolSize, "reportflow-source-pool", true);
    }

    /**
     * Borrow a pooled connection (autocommit off); close it to return it.
     */
    public Connection getConnection() throws SQLException {
        return dataSource.getConnection();
    }

    /**
     * Round-trip check used by the health endpoint.
     */
    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Create the store tables and indexes if missing.
     */
    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- JOBS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS jobs (
                            id              VARCHAR(64) PRIMARY KEY,
                            name            VARCHAR(255) NOT NULL,
                            description     CLOB,
                            query_text      CLOB NOT NULL,
                            schedule_cron   VARCHAR(100) NOT NULL,
                            output_format   VARCHAR(20) DEFAULT 'CSV',
                            is_active       BOOLEAN DEFAULT TRUE,
                            created_at      TIMESTAMP DEFAULT CURRENT_TIMESTAMP,
                            updated_at      TIMESTAMP
                        );
                    """);

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            job_id          VARCHAR(64) NOT NULL REFERENCES jobs(id),
                            trigger_type    VARCHAR(20) NOT NULL,
                            state           VARCHAR(20) NOT NULL,
                            started_at      TIMESTAMP(6) NOT NULL,
                            finished_at     TIMESTAMP(6),
                            row_count       INT,
                            artifact_path   VARCHAR(1024),
                            error_message   CLOB
                        );
                    """);

            // ---------- NOTIFICATIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS notifications (
                            id              VARCHAR(64) PRIMARY KEY,
                            run_id          VARCHAR(64) NOT NULL REFERENCES runs(id),
                            channel         VARCHAR(20) NOT NULL,
                            status          VARCHAR(20) NOT NULL,
                            run_state       VARCHAR(20) NOT NULL,
                            message         CLOB,
                            sent_at         TIMESTAMP(6) NOT NULL
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_jobs_active ON jobs(is_active);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_job_started ON runs(job_id, started_at DESC);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_notifications_run ON notifications(run_id);");

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
