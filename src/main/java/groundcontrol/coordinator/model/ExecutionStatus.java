package groundcontrol.coordinator.model;

/**
 * Status of a single execution attempt.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
