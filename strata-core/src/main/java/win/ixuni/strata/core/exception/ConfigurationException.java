package win.ixuni.strata.core.exception;

/**
 * Invalid or missing unit-of-work configuration
 */
public class ConfigurationException extends StrataException {

    public ConfigurationException(String message) {
        super("InvalidConfiguration", message);
    }
}
