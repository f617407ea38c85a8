package groundcontrol.coordinator.scheduler;

import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskResult;

/**
 * Carries out one task. Supplied by the caller of {@link TaskQueue#executeAll}.
 *
 * <p>Implementations bound their own running time; the queue never cancels
 * or times out an execution. Any exception thrown is recorded as a failed
 * task with the exception message as its result.
 */
@FunctionalInterface
public interface TaskExecutor {

    TaskResult execute(Task task) throws Exception;
}
