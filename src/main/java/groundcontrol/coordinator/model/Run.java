package groundcontrol.coordinator.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model for one orchestration attempt of a project.
 */
public final class Run {
    private final String id;
    private final String projectName;
    private final RunStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final String configSnapshot; // JSON, may be null

    private Run(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.projectName = Objects.requireNonNull(builder.projectName, "projectName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.configSnapshot = builder.configSnapshot;
    }

    public String id() {
        return id;
    }

    public String projectName() {
        return projectName;
    }

    public RunStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public String configSnapshot() {
        return configSnapshot;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .projectName(projectName)
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .configSnapshot(configSnapshot);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String projectName;
        private RunStatus status = RunStatus.PENDING;
        private Instant createdAt;
        private Instant updatedAt;
        private String configSnapshot;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder projectName(String projectName) {
            this.projectName = projectName;
            return this;
        }

        public Builder status(RunStatus status) {
            this.status = status;
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

        public Builder configSnapshot(String configSnapshot) {
            this.configSnapshot = configSnapshot;
            return this;
        }

        public Run build() {
            return new Run(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Run run))
            return false;
        return Objects.equals(id, run.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Run{id='" + id + "', project='" + projectName + "', status=" + status + "}";
    }
}
