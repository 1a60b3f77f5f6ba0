package win.ixuni.strata.core.driver;

import org.slf4j.ILoggerFactory;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.config.StoreConfig;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.unitofwork.UnitOfWork;

/**
 * Unit-of-work factory interface
 * <p>
 * Each store driver provides a factory that turns configuration into typed options and opens units of work.
 */
public interface UnitOfWorkFactory {

    /**
     * Get the store type supported by this factory
     *
     * @return store type identifier (e.g. "memory", "mongodb")
     */
    String getStoreType();

    /**
     * Build driver options from generic store configuration
     *
     * @param config store configuration
     * @return options of the variant this driver accepts
     */
    UnitOfWorkOptions createOptions(StoreConfig config);

    /**
     * Open a unit of work; its transaction is started on return
     *
     * @param cache         shared entity cache, may be null when caching is disabled
     * @param loggerFactory logger factory of the caller
     * @param options       driver options
     * @return the unit of work
     */
    UnitOfWork create(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options);

    /**
     * Get the factory description
     *
     * @return description text
     */
    default String getDescription() {
        return getStoreType() + " unit of work";
    }
}
