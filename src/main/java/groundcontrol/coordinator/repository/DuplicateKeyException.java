package groundcontrol.coordinator.repository;

/**
 * Thrown when an entity is created with an identifier that already exists.
 */
public class DuplicateKeyException extends StoreException {

    public static final String ERROR_CODE = "DUPLICATE_KEY";

    public DuplicateKeyException(String entityType, String entityId, Throwable cause) {
        super(ERROR_CODE, String.format("%s already exists: %s", entityType, entityId), cause);
    }
}
