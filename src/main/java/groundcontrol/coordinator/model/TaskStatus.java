package groundcontrol.coordinator.model;

/**
 * Task lifecycle status.
 * PENDING -> QUEUED -> RUNNING -> {COMPLETED | FAILED}, plus SKIPPED from PENDING.
 */
public enum TaskStatus {
    /** Created, waiting for its dependencies */
    PENDING,
    /** Picked by the scheduler for the current batch */
    QUEUED,
    /** Executor invoked */
    RUNNING,
    /** Executor reported success */
    COMPLETED,
    /** Executor reported failure or faulted */
    FAILED,
    /** Withdrawn by an external caller before it ran */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public boolean isInFlight() {
        return this == QUEUED || this == RUNNING;
    }
}
