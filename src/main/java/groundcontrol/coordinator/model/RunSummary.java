package groundcontrol.coordinator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only accounting of a run: the run itself, its tasks and counts per status.
 * Statuses without tasks are absent from {@link #statusCounts()}.
 *
 * @param run          the run, or null if no such run exists
 * @param tasks        tasks in scheduling order
 * @param statusCounts task count per status
 */
public record RunSummary(Run run, List<Task> tasks, Map<TaskStatus, Integer> statusCounts) {

    public RunSummary {
        tasks = List.copyOf(tasks);
        Map<TaskStatus, Integer> copy = new EnumMap<>(TaskStatus.class);
        copy.putAll(statusCounts);
        statusCounts = Collections.unmodifiableMap(copy);
    }

    public static RunSummary of(Run run, List<Task> tasks) {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (Task task : tasks) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return new RunSummary(run, tasks, counts);
    }

    public int totalTasks() {
        return tasks.size();
    }

    public int count(TaskStatus status) {
        return statusCounts.getOrDefault(status, 0);
    }
}
