package groundcontrol.coordinator.scheduler;

import groundcontrol.coordinator.model.Task;
import groundcontrol.coordinator.model.TaskStatus;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes which tasks may start, from a snapshot of one run's tasks.
 *
 * <p>A task is ready when it is PENDING and every dependency id names a
 * COMPLETED task in the same snapshot. A dependency that is FAILED, SKIPPED
 * or unknown is never satisfied, so the dependent task starves.
 */
public final class ReadinessQuery {

    private ReadinessQuery() {
    }

    /**
     * @param snapshot all tasks of a run, in scheduling order
     * @return ready tasks, keeping the snapshot order
     */
    public static List<Task> readyTasks(List<Task> snapshot) {
        Set<String> completed = snapshot.stream()
                .filter(t -> t.status() == TaskStatus.COMPLETED)
                .map(Task::id)
                .collect(Collectors.toSet());

        return snapshot.stream()
                .filter(t -> t.status() == TaskStatus.PENDING)
                .filter(t -> completed.containsAll(t.dependencies()))
                .toList();
    }

    /**
     * @return true if any task of the snapshot is QUEUED or RUNNING
     */
    public static boolean hasInFlight(List<Task> snapshot) {
        return snapshot.stream().anyMatch(t -> t.status().isInFlight());
    }
}
