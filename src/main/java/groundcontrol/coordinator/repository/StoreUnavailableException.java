package groundcontrol.coordinator.repository;

/**
 * Thrown when the backing database cannot be read or written.
 * Fatal to the scheduler loop; never retried.
 */
public class StoreUnavailableException extends StoreException {

    public static final String ERROR_CODE = "STORE_UNAVAILABLE";

    public StoreUnavailableException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
