package groundcontrol.coordinator.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import groundcontrol.coordinator.config.CoordinatorConfig;
import groundcontrol.coordinator.repository.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Database connection pool and schema management.
 * Uses HikariCP for connection pooling. Connections are handed out with
 * auto-commit disabled; every repository call commits its own work.
 */
public final class Database implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private final HikariDataSource dataSource;

    public Database(CoordinatorConfig config) {
        this(config.databaseUrl(), config.databasePoolSize());
    }

    public Database(String jdbcUrl, int poolSize) {
        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setMaximumPoolSize(poolSize);
        hikariConfig.setMinimumIdle(Math.min(2, poolSize));
        hikariConfig.setConnectionTimeout(5000);
        hikariConfig.setIdleTimeout(300000);
        hikariConfig.setPoolName("ground-control-db-pool");
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

    private void initSchema() {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {

            // ---------- RUNS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS runs (
                            id              VARCHAR(64) PRIMARY KEY,
                            project_name    VARCHAR(256) NOT NULL,
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL,
                            config_snapshot CLOB
                        );
                    """);

            // ---------- TASKS ----------
            // seq breaks created_at ties so listing order is stable
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS tasks (
                            id              VARCHAR(128) PRIMARY KEY,
                            seq             BIGINT GENERATED BY DEFAULT AS IDENTITY,
                            run_id          VARCHAR(64) NOT NULL REFERENCES runs(id),
                            ticket_id       VARCHAR(128),
                            title           VARCHAR(1024) NOT NULL,
                            description     CLOB DEFAULT '' NOT NULL,
                            assigned_agent  VARCHAR(128),
                            status          VARCHAR(20) DEFAULT 'PENDING' NOT NULL,
                            priority        INT DEFAULT 0 NOT NULL,
                            dependencies    CLOB DEFAULT '[]' NOT NULL,
                            result          CLOB,
                            created_at      TIMESTAMP NOT NULL,
                            updated_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- TASK LOGS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS task_logs (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(128) NOT NULL REFERENCES tasks(id),
                            agent_name      VARCHAR(128),
                            level           VARCHAR(16) DEFAULT 'INFO' NOT NULL,
                            message         CLOB NOT NULL,
                            metadata        CLOB,
                            created_at      TIMESTAMP NOT NULL
                        );
                    """);

            // ---------- AGENT EXECUTIONS ----------
            st.addBatch("""
                        CREATE TABLE IF NOT EXISTS agent_executions (
                            id              BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                            task_id         VARCHAR(128) NOT NULL REFERENCES tasks(id),
                            run_id          VARCHAR(64) NOT NULL REFERENCES runs(id),
                            agent_name      VARCHAR(128) NOT NULL,
                            implementer     VARCHAR(64),
                            status          VARCHAR(20) DEFAULT 'RUNNING' NOT NULL,
                            input_prompt    CLOB,
                            output          CLOB,
                            error           CLOB,
                            tokens_used     CLOB,
                            started_at      TIMESTAMP,
                            finished_at     TIMESTAMP
                        );
                    """);

            // Indexes
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_run_id ON tasks(run_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_tasks_status ON tasks(status);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_task_logs_task_id ON task_logs(task_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_agent_executions_run_id ON agent_executions(run_id);");
            st.addBatch("CREATE INDEX IF NOT EXISTS idx_runs_project ON runs(project_name, created_at);");

            st.executeBatch();
            conn.commit();

            log.info("Database schema initialized");
        } catch (SQLException e) {
            dataSource.close();
            throw new StoreUnavailableException("Failed to initialize database schema", e);
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
