package cockpit.jobs.store;

import cockpit.jobs.config.JobsConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Set;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit off; every repository method commits its own transaction.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private static final String UNIQUE_VIOLATION = "23505";
    // H2 reports a missing parent row as 23506, PostgreSQL as 23503
    private static final Set<String> FOREIGN_KEY_VIOLATIONS = Set.of("23503", "23506");

    private final HikariDataSource dataSource;

    public Database(JobsConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(2);
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("cockpit-jobs-db-pool");
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

    public boolean isHealthy() {
        try (Connection conn = getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }

    /** Check whether a failure was caused by a unique index. */
    static boolean isUniqueViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (UNIQUE_VIOLATION.equals(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    /** Check whether a failure was caused by a missing referenced row. */
    static boolean isForeignKeyViolation(SQLException e) {
        for (SQLException cur = e; cur != null; cur = cur.getNextException()) {
            if (FOREIGN_KEY_VIOLATIONS.contains(cur.getSQLState())) {
                return true;
            }
        }
        return false;
    }

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- TEMPLATES ----------
            // scope_key is 'global' or 'user:<owner>' so names stay unique per visibility scope
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_templates (
                            id               VARCHAR(64) PRIMARY KEY,
                            name             VARCHAR(255) NOT NULL,
                            job_type         VARCHAR(64) NOT NULL,
                            description      VARCHAR(1000),
                            inventory_source VARCHAR(16) DEFAULT 'ALL',
                            parameters       CLOB,
                            is_global        BOOLEAN DEFAULT FALSE,
                            owner_id         VARCHAR(128),
                            scope_key        VARCHAR(160) NOT NULL,
                            created_by       VARCHAR(128),
                            created_at       TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            updated_at       TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP
                        );
                    """);

            // ---------- SCHEDULES ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_schedules (
                            id                  VARCHAR(64) PRIMARY KEY,
                            name                VARCHAR(255) NOT NULL,
                            template_id         VARCHAR(64),
                            cron_expression     VARCHAR(128) NOT NULL,
                            time_zone           VARCHAR(64) DEFAULT 'UTC',
                            enabled             BOOLEAN DEFAULT TRUE,
                            parameter_overrides CLOB,
                            target_devices      CLOB,
                            next_run_at         TIMESTAMP WITH TIME ZONE,
                            last_run_id         VARCHAR(64),
                            created_by          VARCHAR(128),
                            created_at          TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            updated_at          TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            CONSTRAINT fk_schedules_template FOREIGN KEY (template_id) REFERENCES job_templates(id)
                        );
                    """);

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS job_runs (
                            id               VARCHAR(64) PRIMARY KEY,
                            job_schedule_id  VARCHAR(64),
                            job_template_id  VARCHAR(64),
                            external_task_id VARCHAR(128),
                            job_name         VARCHAR(255) NOT NULL,
                            job_type         VARCHAR(64) NOT NULL,
                            status           VARCHAR(20) DEFAULT 'QUEUED',
                            triggered_by     VARCHAR(128),
                            scheduled_for    TIMESTAMP WITH TIME ZONE,
                            queued_at        TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP,
                            started_at       TIMESTAMP WITH TIME ZONE,
                            completed_at     TIMESTAMP WITH TIME ZONE,
                            error_code       VARCHAR(32),
                            error_message    VARCHAR(2048),
                            result           CLOB,
                            parameters       CLOB,
                            target_devices   CLOB,
                            executed_by      VARCHAR(128),
                            attempts         INT DEFAULT 0,
                            cancel_requested BOOLEAN DEFAULT FALSE,
                            heartbeat_at     TIMESTAMP WITH TIME ZONE,
                            CONSTRAINT chk_runs_completed_iff_terminal CHECK (
                                (status IN ('SUCCEEDED', 'FAILED', 'CANCELLED')) = (completed_at IS NOT NULL)
                            )
                        );
                    """);

            // Indexes
            st.addBatch("CREATE UNIQUE INDEX IF NOT EXISTS uq_templates_scope_name ON job_templates(scope_key, name);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_due ON job_schedules(enabled, next_run_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_schedules_template ON job_schedules(template_id);");
            st.addBatch(
                    "CREATE UNIQUE INDEX IF NOT EXISTS uq_runs_occurrence ON job_runs(job_schedule_id, scheduled_for);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_status_queued ON job_runs(status, queued_at);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_template ON job_runs(job_template_id);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize database schema", e);
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
