package win.ixuni.strata.core.exception;

/**
 * Entity not found exception
 */
public class EntityNotFoundException extends StrataException {

    public EntityNotFoundException(String collectionName, String id) {
        super("NoSuchEntity", "The specified entity does not exist: " + collectionName + "/" + id);
    }
}
