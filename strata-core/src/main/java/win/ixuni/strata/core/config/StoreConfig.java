package win.ixuni.strata.core.config;

import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Store configuration
 * <p>
 * Generic configuration of one backing store. Driver-specific settings live in properties and are turned into
 * typed {@link UnitOfWorkOptions} by the matching factory.
 */
@Data
public class StoreConfig {

    /**
     * Store instance name (unique identifier)
     */
    private String name;

    /**
     * Store type (memory, mongodb)
     */
    private String type;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get a long integer configuration value
     */
    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * Get a boolean configuration value
     */
    public Boolean getBoolean(String key, Boolean defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    /**
     * Get a duration configured in milliseconds
     */
    public Duration getMillis(String key, Duration defaultValue) {
        Long millis = getLong(key, null);
        return millis != null ? Duration.ofMillis(millis) : defaultValue;
    }

    /**
     * Fill the options shared by every driver
     *
     * @param builder driver options builder to fill
     * @return the same builder
     */
    public <B extends UnitOfWorkOptions.UnitOfWorkOptionsBuilder<?, ?>> B applyCommon(B builder) {
        CommitRetrySettings defaults = CommitRetrySettings.defaults();
        builder.actorId(getString("actor-id", null));
        builder.logTime(getBoolean("log-time", false));
        builder.cacheEnabled(getBoolean("cache-enabled", true));
        builder.environment(getString("environment", null));
        builder.commitRetry(CommitRetrySettings.builder()
                .maxRetries(getLong("commit-max-retries", defaults.getMaxRetries()))
                .minBackoff(getMillis("commit-min-backoff-ms", defaults.getMinBackoff()))
                .maxBackoff(getMillis("commit-max-backoff-ms", defaults.getMaxBackoff()))
                .build());
        return builder;
    }
}
