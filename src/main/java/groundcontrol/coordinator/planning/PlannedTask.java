package groundcontrol.coordinator.planning;

import java.util.List;

/**
 * One atomic task produced by a {@link Planner}.
 *
 * @param ticketId source ticket, may be null
 */
public record PlannedTask(String id, String title, String description, String assignedAgent,
        int priority, List<String> dependencies, String ticketId) {

    public PlannedTask {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("task id is required");
        }
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("task title is required");
        }
        description = description != null ? description : "";
        dependencies = dependencies != null ? List.copyOf(dependencies) : List.of();
    }

    public static PlannedTask of(String id, String title, String assignedAgent, String... dependsOn) {
        return new PlannedTask(id, title, "", assignedAgent, 0, List.of(dependsOn), null);
    }

    public PlannedTask withPriority(int priority) {
        return new PlannedTask(id, title, description, assignedAgent, priority, dependencies, ticketId);
    }
}
