package groundcontrol.coordinator.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model for one unit of delegated work inside a run.
 * Instances are point-in-time reads; the store holds the authoritative copy.
 */
public final class Task {
    private final String id;
    private final String runId;
    private final String ticketId;
    private final String title;
    private final String description;
    private final String assignedAgent;
    private final TaskStatus status;
    private final int priority; // higher = more urgent
    private final List<String> dependencies;
    private final String result; // success output or failure reason
    private final Instant createdAt;
    private final Instant updatedAt;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.ticketId = builder.ticketId;
        this.title = Objects.requireNonNull(builder.title, "title is required");
        this.description = builder.description != null ? builder.description : "";
        this.assignedAgent = builder.assignedAgent;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.priority = builder.priority;
        this.dependencies = builder.dependencies != null ? List.copyOf(builder.dependencies) : List.of();
        this.result = builder.result;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
    }

    public String id() {
        return id;
    }

    public String runId() {
        return runId;
    }

    public String ticketId() {
        return ticketId;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String assignedAgent() {
        return assignedAgent;
    }

    public TaskStatus status() {
        return status;
    }

    public int priority() {
        return priority;
    }

    public List<String> dependencies() {
        return dependencies;
    }

    public String result() {
        return result;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .runId(runId)
                .ticketId(ticketId)
                .title(title)
                .description(description)
                .assignedAgent(assignedAgent)
                .status(status)
                .priority(priority)
                .dependencies(dependencies)
                .result(result)
                .createdAt(createdAt)
                .updatedAt(updatedAt);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String runId;
        private String ticketId;
        private String title;
        private String description;
        private String assignedAgent;
        private TaskStatus status = TaskStatus.PENDING;
        private int priority = 0;
        private List<String> dependencies;
        private String result;
        private Instant createdAt;
        private Instant updatedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder ticketId(String ticketId) {
            this.ticketId = ticketId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder assignedAgent(String assignedAgent) {
            this.assignedAgent = assignedAgent;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependencies(List<String> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder dependsOn(String... taskIds) {
            this.dependencies = List.of(taskIds);
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", priority=" + priority
                + ", dependencies=" + dependencies + "}";
    }
}
