package groundcontrol.coordinator.store;

import groundcontrol.coordinator.model.LogLevel;
import groundcontrol.coordinator.model.TaskLog;
import groundcontrol.coordinator.repository.NotFoundException;
import groundcontrol.coordinator.repository.TaskLogRepository;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JDBC implementation of TaskLogRepository.
 */
public class JdbcTaskLogRepository implements TaskLogRepository {

    private final Database db;

    public JdbcTaskLogRepository(Database db) {
        this.db = db;
    }

    @Override
    public long append(String taskId, LogLevel level, String message, String agentName,
            Map<String, Object> metadata) {
        String sql = """
                    INSERT INTO task_logs (task_id, agent_name, level, message, metadata, created_at)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            ps.setString(1, taskId);
            ps.setString(2, agentName);
            ps.setString(3, level.name());
            ps.setString(4, message);
            ps.setString(5, JsonColumns.write(metadata));
            ps.setTimestamp(6, Timestamp.from(Instant.now()));

            ps.executeUpdate();
            long id = generatedId(ps);
            conn.commit();
            return id;
        } catch (SQLException e) {
            if (SqlErrors.isMissingParent(e)) {
                throw new NotFoundException("Task", taskId, e);
            }
            throw SqlErrors.unavailable("Failed to append log for task: " + taskId, e);
        }
    }

    @Override
    public List<TaskLog> findByTaskId(String taskId) {
        String sql = "SELECT * FROM task_logs WHERE task_id = ? ORDER BY created_at, id";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            List<TaskLog> logs = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    logs.add(new TaskLog(
                            rs.getLong("id"),
                            rs.getString("task_id"),
                            rs.getString("agent_name"),
                            LogLevel.valueOf(rs.getString("level")),
                            rs.getString("message"),
                            JsonColumns.readMap(rs.getString("metadata")),
                            rs.getTimestamp("created_at").toInstant()));
                }
            }
            return logs;
        } catch (SQLException e) {
            throw SqlErrors.unavailable("Failed to read logs for task: " + taskId, e);
        }
    }

    static long generatedId(PreparedStatement ps) throws SQLException {
        try (ResultSet keys = ps.getGeneratedKeys()) {
            if (!keys.next()) {
                throw new SQLException("No generated key returned");
            }
            return keys.getLong(1);
        }
    }
}
