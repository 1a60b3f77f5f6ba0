package win.ixuni.strata.core.exception;

/**
 * Entity already exists exception
 */
public class EntityAlreadyExistsException extends StrataException {

    public EntityAlreadyExistsException(String collectionName, String id) {
        super("EntityAlreadyExists", "An entity with this id already exists: " + collectionName + "/" + id);
    }
}
