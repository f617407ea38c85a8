package groundcontrol.coordinator.repository;

/**
 * Base exception for all state store errors.
 */
public class StoreException extends RuntimeException {

    private final String errorCode;

    public StoreException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StoreException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
