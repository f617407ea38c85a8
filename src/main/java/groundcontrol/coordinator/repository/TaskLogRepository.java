package groundcontrol.coordinator.repository;

import groundcontrol.coordinator.model.LogLevel;
import groundcontrol.coordinator.model.TaskLog;

import java.util.List;
import java.util.Map;

/**
 * Append-only repository for task log entries.
 */
public interface TaskLogRepository {

    /**
     * Append a log entry.
     *
     * @return generated log id
     * @throws NotFoundException if the task does not exist
     */
    long append(String taskId, LogLevel level, String message, String agentName, Map<String, Object> metadata);

    /**
     * Get log entries of a task in the order they were written.
     */
    List<TaskLog> findByTaskId(String taskId);
}
