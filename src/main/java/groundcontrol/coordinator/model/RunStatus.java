package groundcontrol.coordinator.model;

/**
 * Run status: PENDING -> PLANNING -> RUNNING -> {COMPLETED | FAILED}.
 */
public enum RunStatus {
    PENDING,
    PLANNING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
