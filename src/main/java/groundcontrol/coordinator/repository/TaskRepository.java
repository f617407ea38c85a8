package groundcontrol.coordinator.repository;

import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Task persistence.
 */
public interface TaskRepository {

    /**
     * Save a new task. Its status is stored as given.
     *
     * @param task the task to save
     * @throws DuplicateKeyException if a task with the same id exists
     * @throws NotFoundException     if the owning run does not exist
     */
    void save(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(String taskId);

    /**
     * Find all tasks of a run, ordered by priority descending then creation order.
     *
     * @param runId the run ID
     * @return list of tasks
     */
    List<Task> findByRunId(String runId);

    /**
     * Update task status and, when {@code result} is non-null, its result text.
     * A task already in a terminal status is left untouched.
     *
     * @param taskId the task ID
     * @param status the new status
     * @param result result text, or null to keep the current one
     * @return true if updated, false if the task was already terminal
     * @throws NotFoundException if the task does not exist
     */
    boolean updateStatus(String taskId, TaskStatus status, String result);
}
