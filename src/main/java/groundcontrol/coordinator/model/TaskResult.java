package groundcontrol.coordinator.model;

/**
 * Outcome of executing one task.
 *
 * @param taskId  the task this outcome belongs to
 * @param success whether the executor reported success
 * @param output  executor output (empty when none)
 * @param error   failure reason, null on success
 */
public record TaskResult(String taskId, boolean success, String output, String error) {

    public TaskResult {
        output = output != null ? output : "";
    }

    public static TaskResult success(String taskId, String output) {
        return new TaskResult(taskId, true, output, null);
    }

    public static TaskResult failure(String taskId, String error) {
        return new TaskResult(taskId, false, "", error);
    }
}
