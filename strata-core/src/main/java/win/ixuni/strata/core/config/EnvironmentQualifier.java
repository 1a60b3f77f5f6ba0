package win.ixuni.strata.core.config;

import java.util.Map;

/**
 * Deployment qualifier appended to database names
 */
public final class EnvironmentQualifier {

    public static final String DEFAULT = "Development";

    /**
     * Environment variable read by {@link #fromEnvironment(Map)}
     */
    public static final String VARIABLE = "STRATA_ENVIRONMENT";

    private EnvironmentQualifier() {
    }

    /**
     * @param configured configured qualifier, may be null
     * @return the qualifier, or {@value #DEFAULT} when null or blank
     */
    public static String resolve(String configured) {
        if (configured == null || configured.isBlank()) {
            return DEFAULT;
        }
        return configured.trim();
    }

    /**
     * Resolve from an explicitly supplied environment, e.g. {@code System.getenv()}
     */
    public static String fromEnvironment(Map<String, String> environment) {
        return resolve(environment.get(VARIABLE));
    }

    /**
     * @return {@code "<databaseName>-<qualifier>"}
     */
    public static String qualify(String databaseName, String qualifier) {
        return databaseName + "-" + resolve(qualifier);
    }
}
