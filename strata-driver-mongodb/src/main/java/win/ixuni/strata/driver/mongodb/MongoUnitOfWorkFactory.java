package win.ixuni.strata.driver.mongodb;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.ILoggerFactory;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.config.StoreConfig;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.driver.UnitOfWorkFactory;
import win.ixuni.strata.core.unitofwork.UnitOfWork;
import win.ixuni.strata.driver.mongodb.config.MongoConnectionSettings;
import win.ixuni.strata.driver.mongodb.config.MongoUnitOfWorkOptions;

import java.time.Duration;

/**
 * MongoDB unit-of-work factory
 * <p>
 * Each unit of work opens its own client; pool clients at a higher level when units of work are short-lived and
 * frequent.
 */
@Slf4j
public class MongoUnitOfWorkFactory implements UnitOfWorkFactory {

    public static final String STORE_TYPE = "mongodb";

    @Override
    public String getStoreType() {
        return STORE_TYPE;
    }

    @Override
    public UnitOfWorkOptions createOptions(StoreConfig config) {
        String connectionString = config.getString("connection-string", "mongodb://localhost:27017");
        MongoUnitOfWorkOptions.MongoUnitOfWorkOptionsBuilder<?, ?> builder = MongoUnitOfWorkOptions.builder()
                .connectionString(connectionString)
                .databaseName(config.getString("database", config.getName()))
                .serverSelectionTimeout(config.getMillis("server-selection-timeout-ms", Duration.ofSeconds(30)));
        log.info("Creating MongoDB options for store: {}, uri: {}",
                config.getName(), MongoConnectionSettings.redact(connectionString));
        return config.applyCommon(builder).build();
    }

    @Override
    public UnitOfWork create(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options) {
        return new MongoUnitOfWork(cache, loggerFactory, options);
    }

    @Override
    public String getDescription() {
        return "MongoDB Reactive Streams unit of work with multi-document transactions";
    }
}
