package win.ixuni.strata.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strata main configuration
 */
@Data
@ConfigurationProperties(prefix = "strata")
public class StrataProperties {

    /**
     * List of store configurations
     */
    private List<StoreConfig> stores = new ArrayList<>();

    /**
     * Name of the store used when none is requested explicitly
     */
    private String defaultStore;

    /**
     * Find a store by name
     */
    public Optional<StoreConfig> findStore(String name) {
        return stores.stream()
                .filter(store -> name.equals(store.getName()))
                .findFirst();
    }

    /**
     * Default store; the first one when defaultStore is not set
     */
    public Optional<StoreConfig> getDefault() {
        if (defaultStore != null) {
            return findStore(defaultStore);
        }
        return stores.stream().findFirst();
    }
}
