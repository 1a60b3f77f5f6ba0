package win.ixuni.strata.driver.mongodb;

import com.mongodb.reactivestreams.client.ClientSession;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import com.mongodb.reactivestreams.client.MongoDatabase;
import lombok.Getter;
import org.slf4j.ILoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.config.EnvironmentQualifier;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.exception.ConfigurationException;
import win.ixuni.strata.core.exception.StoreConnectionException;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.unitofwork.AbstractUnitOfWork;
import win.ixuni.strata.core.unitofwork.TransactionSession;
import win.ixuni.strata.driver.mongodb.collection.MongoEntityCollection;
import win.ixuni.strata.driver.mongodb.config.MongoConnectionSettings;
import win.ixuni.strata.driver.mongodb.config.MongoUnitOfWorkOptions;
import win.ixuni.strata.driver.mongodb.session.MongoTransactionSession;

/**
 * Unit of work for MongoDB
 * <p>
 * Connects on construction, opens a client session on {@code "<databaseName>-<qualifier>"} and starts its
 * transaction. There is no partially constructed state: any connection failure is logged as critical and raised.
 * Transactions need a replica set or sharded cluster.
 */
public class MongoUnitOfWork extends AbstractUnitOfWork {

    private static final Marker CRITICAL = MarkerFactory.getMarker("CRITICAL");

    @Getter
    private final String databaseId;

    private final MongoClient client;
    private final MongoDatabase database;
    private final MongoTransactionSession session;

    public MongoUnitOfWork(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options) {
        super(cache, loggerFactory, options);
        MongoUnitOfWorkOptions mongoOptions = requireOptions(options, MongoUnitOfWorkOptions.class);
        validate(mongoOptions);
        this.databaseId = EnvironmentQualifier.qualify(mongoOptions.getDatabaseName(), mongoOptions.getQualifier());

        MongoClient mongoClient = null;
        try {
            mongoClient = MongoClients.create(MongoConnectionSettings.build(mongoOptions));
            MongoDatabase mongoDatabase = mongoClient.getDatabase(databaseId);
            ClientSession clientSession = Mono.from(mongoClient.startSession()).block();
            if (clientSession == null) {
                throw new IllegalStateException("MongoDB returned no client session");
            }
            clientSession.startTransaction();

            this.client = mongoClient;
            this.database = mongoDatabase;
            this.session = new MongoTransactionSession(clientSession);
        } catch (RuntimeException e) {
            String target = MongoConnectionSettings.redact(mongoOptions.getConnectionString());
            logger.error(CRITICAL, "Error while connecting to {}.", target, e);
            if (mongoClient != null) {
                mongoClient.close();
            }
            throw new StoreConnectionException(target, e);
        }
        logger.debug("Started MongoDB transaction on {}", databaseId);
    }

    private static void validate(MongoUnitOfWorkOptions options) {
        if (options.getConnectionString() == null || options.getConnectionString().isBlank()) {
            throw new ConfigurationException("MongoDB connection string is required");
        }
        if (options.getDatabaseName() == null || options.getDatabaseName().isBlank()) {
            throw new ConfigurationException("MongoDB database name is required");
        }
    }

    @Override
    protected TransactionSession session() {
        return session;
    }

    @Override
    protected <T extends StoredEntity> EntityCollection<T> createCollection(EntityType<T> type) {
        return new MongoEntityCollection<>(type, database.getCollection(type.getCollectionName()),
                session.getClientSession());
    }

    @Override
    protected void release() {
        try {
            session.close();
        } finally {
            client.close();
        }
    }
}
