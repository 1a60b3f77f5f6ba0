package win.ixuni.strata.core.exception;

/**
 * Entity could not be converted to or from its stored document form
 */
public class EntityMappingException extends StrataException {

    public EntityMappingException(String message, Throwable cause) {
        super("MappingFailed", message, cause);
    }
}
