package groundcontrol.coordinator.repository;

/**
 * Thrown when an update or append targets an unknown identifier.
 */
public class NotFoundException extends StoreException {

    public static final String ERROR_CODE = "NOT_FOUND";

    public NotFoundException(String entityType, String entityId) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId));
    }

    public NotFoundException(String entityType, String entityId, Throwable cause) {
        super(ERROR_CODE, String.format("%s not found: %s", entityType, entityId), cause);
    }
}
