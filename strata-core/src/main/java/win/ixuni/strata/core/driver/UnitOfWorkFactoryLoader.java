package win.ixuni.strata.core.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strata.core.config.StoreConfig;
import win.ixuni.strata.core.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Unit-of-work factory loader
 * <p>
 * Uses Java SPI (ServiceLoader) to discover UnitOfWorkFactory implementations on the classpath.
 * Drivers declare themselves in META-INF/services to be picked up.
 */
@Slf4j
public final class UnitOfWorkFactoryLoader {

    private UnitOfWorkFactoryLoader() {
        // Utility class, not instantiable
    }

    /**
     * Load all UnitOfWorkFactory implementations via SPI
     *
     * @return list of discovered factories
     */
    public static List<UnitOfWorkFactory> load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Load all UnitOfWorkFactory implementations via SPI
     *
     * @param classLoader class loader
     * @return list of discovered factories
     */
    public static List<UnitOfWorkFactory> load(ClassLoader classLoader) {
        ServiceLoader<UnitOfWorkFactory> loader = ServiceLoader.load(UnitOfWorkFactory.class, classLoader);
        List<UnitOfWorkFactory> factories = new ArrayList<>();

        for (UnitOfWorkFactory factory : loader) {
            factories.add(factory);
            log.info("Discovered unit-of-work factory via SPI: {} - {}",
                    factory.getStoreType(), factory.getDescription());
        }

        if (factories.isEmpty()) {
            log.warn("No UnitOfWorkFactory implementations found via SPI");
        }

        return Collections.unmodifiableList(factories);
    }

    /**
     * Find the factory of a store type
     */
    public static Optional<UnitOfWorkFactory> find(String storeType) {
        return load().stream()
                .filter(factory -> factory.getStoreType().equalsIgnoreCase(storeType))
                .findFirst();
    }

    /**
     * Find the factory matching a store configuration
     *
     * @throws ConfigurationException when no driver supports the configured type
     */
    public static UnitOfWorkFactory forConfig(StoreConfig config) {
        if (config.getType() == null) {
            throw new ConfigurationException("Store '" + config.getName() + "' has no type");
        }
        return find(config.getType())
                .orElseThrow(() -> new ConfigurationException("No driver found for store type: " + config.getType()));
    }
}
