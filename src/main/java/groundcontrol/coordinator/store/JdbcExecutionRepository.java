package groundcontrol.coordinator.store;

import groundcontrol.coordinator.model.Execution;
import groundcontrol.coordinator.model.ExecutionStatus;
import groundcontrol.coordinator.repository.ExecutionRepository;
import groundcontrol.coordinator.repository.NotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * JDBC implementation of ExecutionRepository.
 */
public class JdbcExecutionRepository implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcExecutionRepository.class);

    private final Database db;

    public JdbcExecutionRepository(Database db) {
        this.db = db;
    }

    @Override
    public long create(String taskId, String runId, String agentName, String implementer, String inputPrompt) {
        String sql = """
                    INSERT INTO agent_executions (task_id, run_id, agent_name, implementer, status, input_prompt, started_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, taskId);
            ps.setString(2, runId);
            ps.setString(3, agentName);
            ps.setString(4, implementer);
            ps.setString(5, ExecutionStatus.RUNNING.name());
            ps.setString(6, inputPrompt);
            ps.setTimestamp(7, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            long id = JdbcTaskLogRepository.generatedId(ps);
            conn.commit();

            log.debug("Execution {} started for task {} ({} via {})", id, taskId, agentName, implementer);
            return id;
        } catch (SQLException e) {
            if (SqlErrors.isMissingParent(e)) {
                throw new NotFoundException("Task or run", taskId + " / " + runId, e);
            }
            throw SqlErrors.unavailable("Failed to create execution for task: " + taskId, e);
        }
    }

    @Override
    public void finish(long executionId, ExecutionStatus status, String output, String error,
            Map<String, Object> tokensUsed) {
        String sql = """
                    UPDATE agent_executions
                    SET status = ?, output = ?, error = ?, tokens_used = ?, finished_at = ?
                    WHERE id = ?
                """;

        int updated;
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setString(2, output);
            ps.setString(3, error);
            ps.setString(4, JsonColumns.write(tokensUsed));
            ps.setTimestamp(5, Timestamp.from(Instant.now()));
            ps.setLong(6, executionId);

            updated = ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to finish execution: " + executionId, e);
        }

        if (updated == 0) {
            throw new NotFoundException("Execution", String.valueOf(executionId));
        }
        log.debug("Execution {} finished: {}", executionId, status);
    }

    @Override
    public Optional<Execution> findById(long executionId) {
        String sql = "SELECT * FROM agent_executions WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setLong(1, executionId);
            List<Execution> found = executeQuery(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find execution: " + executionId, e);
        }
    }

    @Override
    public List<Execution> findByRunId(String runId) {
        String sql = "SELECT * FROM agent_executions WHERE run_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find executions for run: " + runId, e);
        }
    }

    @Override
    public List<Execution> findByTaskId(String taskId) {
        String sql = "SELECT * FROM agent_executions WHERE task_id = ? ORDER BY id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find executions for task: " + taskId, e);
        }
    }

    private List<Execution> executeQuery(PreparedStatement ps) throws SQLException {
        List<Execution> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Execution mapRow(ResultSet rs) throws SQLException {
        return new Execution(
                rs.getLong("id"),
                rs.getString("task_id"),
                rs.getString("run_id"),
                rs.getString("agent_name"),
                rs.getString("implementer"),
                ExecutionStatus.valueOf(rs.getString("status")),
                rs.getString("input_prompt"),
                rs.getString("output"),
                rs.getString("error"),
                JsonColumns.readMap(rs.getString("tokens_used")),
                toInstant(rs.getTimestamp("started_at")),
                toInstant(rs.getTimestamp("finished_at")));
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
