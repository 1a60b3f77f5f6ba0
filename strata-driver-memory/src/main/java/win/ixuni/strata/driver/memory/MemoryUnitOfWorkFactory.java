package win.ixuni.strata.driver.memory;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.config.StoreConfig;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.driver.UnitOfWorkFactory;
import win.ixuni.strata.core.unitofwork.UnitOfWork;
import win.ixuni.strata.driver.memory.config.MemoryUnitOfWorkOptions;
import win.ixuni.strata.driver.memory.store.MemoryDocumentStore;

/**
 * Memory unit-of-work factory
 * <p>
 * All units of work created by one factory share its document store.
 */
@Slf4j
public class MemoryUnitOfWorkFactory implements UnitOfWorkFactory {

    public static final String STORE_TYPE = "memory";

    private final MemoryDocumentStore store;

    public MemoryUnitOfWorkFactory() {
        this(MemoryDocumentStore.getDefault());
    }

    public MemoryUnitOfWorkFactory(MemoryDocumentStore store) {
        this.store = store;
    }

    @Override
    public String getStoreType() {
        return STORE_TYPE;
    }

    @Override
    public UnitOfWorkOptions createOptions(StoreConfig config) {
        MemoryUnitOfWorkOptions.MemoryUnitOfWorkOptionsBuilder<?, ?> builder = MemoryUnitOfWorkOptions.builder()
                .databaseName(config.getString("database", config.getName()));
        return config.applyCommon(builder).build();
    }

    @Override
    public UnitOfWork create(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options) {
        return new MemoryUnitOfWork(cache, loggerFactory, options, store);
    }

    @Override
    public String getDescription() {
        return "In-memory document store with staged transactions";
    }
}
