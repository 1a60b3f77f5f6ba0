package win.ixuni.strata.driver.memory;

import lombok.Getter;
import org.slf4j.ILoggerFactory;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.config.EnvironmentQualifier;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.exception.ConfigurationException;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.unitofwork.AbstractUnitOfWork;
import win.ixuni.strata.core.unitofwork.TransactionSession;
import win.ixuni.strata.driver.memory.collection.MemoryEntityCollection;
import win.ixuni.strata.driver.memory.config.MemoryUnitOfWorkOptions;
import win.ixuni.strata.driver.memory.session.MemoryTransactionSession;
import win.ixuni.strata.driver.memory.store.MemoryDocumentStore;

/**
 * Unit of work over the in-memory document store
 */
public class MemoryUnitOfWork extends AbstractUnitOfWork {

    @Getter
    private final String databaseId;

    private final MemoryTransactionSession session;

    public MemoryUnitOfWork(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options) {
        this(cache, loggerFactory, options, MemoryDocumentStore.getDefault());
    }

    public MemoryUnitOfWork(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options,
                            MemoryDocumentStore store) {
        super(cache, loggerFactory, options);
        MemoryUnitOfWorkOptions memoryOptions = requireOptions(options, MemoryUnitOfWorkOptions.class);
        if (memoryOptions.getDatabaseName() == null || memoryOptions.getDatabaseName().isBlank()) {
            throw new ConfigurationException("Memory store requires a database name");
        }
        this.databaseId = EnvironmentQualifier.qualify(memoryOptions.getDatabaseName(), memoryOptions.getQualifier());
        this.session = new MemoryTransactionSession(store.getDatabase(databaseId));
        logger.debug("Started memory transaction on {}", databaseId);
    }

    @Override
    protected TransactionSession session() {
        return session;
    }

    @Override
    protected <T extends StoredEntity> EntityCollection<T> createCollection(EntityType<T> type) {
        return new MemoryEntityCollection<>(type, session);
    }

    @Override
    protected void release() {
        session.close();
    }
}
