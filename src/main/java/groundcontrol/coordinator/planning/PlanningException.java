package groundcontrol.coordinator.planning;

/**
 * A {@link Planner} failed with a checked exception.
 */
public class PlanningException extends RuntimeException {

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
