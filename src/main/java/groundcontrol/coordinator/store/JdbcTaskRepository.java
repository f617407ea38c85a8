package groundcontrol.coordinator.store;

import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskStatus;
import groundcontrol.coordinator.repository.DuplicateKeyException;
import groundcontrol.coordinator.repository.NotFoundException;
import groundcontrol.coordinator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * Every write is a single statement committed before the call returns.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    // terminal statuses are never left
    private static final String NOT_TERMINAL = "status NOT IN ('COMPLETED', 'FAILED', 'SKIPPED')";

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, run_id, ticket_id, title, description, assigned_agent, status,
                                       priority, dependencies, result, created_at, updated_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        Instant now = Instant.now();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.runId());
            ps.setString(3, task.ticketId());
            ps.setString(4, task.title());
            ps.setString(5, task.description());
            ps.setString(6, task.assignedAgent());
            ps.setString(7, task.status().name());
            ps.setInt(8, task.priority());
            ps.setString(9, JsonColumns.writeList(task.dependencies()));
            ps.setString(10, task.result());
            ps.setTimestamp(11, Timestamp.from(task.createdAt() != null ? task.createdAt() : now));
            ps.setTimestamp(12, Timestamp.from(task.updatedAt() != null ? task.updatedAt() : now));

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved task {} for run {}", task.id(), task.runId());
        } catch (SQLException e) {
            if (SqlErrors.isDuplicateKey(e)) {
                throw new DuplicateKeyException("Task", task.id(), e);
            }
            if (SqlErrors.isMissingParent(e)) {
                throw new NotFoundException("Run", task.runId(), e);
            }
            throw SqlErrors.unavailable("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findByRunId(String runId) {
        String sql = "SELECT * FROM tasks WHERE run_id = ? ORDER BY priority DESC, created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, runId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to find tasks for run: " + runId, e);
        }
    }

    @Override
    public boolean updateStatus(String taskId, TaskStatus status, String result) {
        String sql = result != null
                ? "UPDATE tasks SET status = ?, updated_at = ?, result = ? WHERE id = ? AND " + NOT_TERMINAL
                : "UPDATE tasks SET status = ?, updated_at = ? WHERE id = ? AND " + NOT_TERMINAL;

        try (Connection conn = db.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                int index = 1;
                ps.setString(index++, status.name());
                ps.setTimestamp(index++, Timestamp.from(Instant.now()));
                if (result != null) {
                    ps.setString(index++, result);
                }
                ps.setString(index, taskId);
                updated = ps.executeUpdate();
            }
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} -> {}", taskId, status);
                return true;
            }

            // Nothing matched: either unknown or already terminal
            Optional<TaskStatus> current = currentStatus(conn, taskId);
            if (current.isEmpty()) {
                throw new NotFoundException("Task", taskId);
            }
            log.debug("Task {} already terminal ({}), ignoring transition to {}", taskId, current.get(), status);
            return false;
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to update task status: " + taskId, e);
        }
    }

    private Optional<TaskStatus> currentStatus(Connection conn, String taskId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT status FROM tasks WHERE id = ?")) {
            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(TaskStatus.valueOf(rs.getString(1)));
                }
            }
            return Optional.empty();
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(rs.getString("id"))
                .runId(rs.getString("run_id"))
                .ticketId(rs.getString("ticket_id"))
                .title(rs.getString("title"))
                .description(rs.getString("description"))
                .assignedAgent(rs.getString("assigned_agent"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .priority(rs.getInt("priority"))
                .dependencies(JsonColumns.readList(rs.getString("dependencies")))
                .result(rs.getString("result"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
