package win.ixuni.strata.core.unitofwork;

import lombok.Getter;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.config.CommitRetrySettings;
import win.ixuni.strata.core.config.UnitOfWorkOptions;
import win.ixuni.strata.core.exception.AmbiguousCommitException;
import win.ixuni.strata.core.exception.CommitRetryExhaustedException;
import win.ixuni.strata.core.exception.ConfigurationException;
import win.ixuni.strata.core.exception.IllegalTransactionStateException;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.pipeline.CollectionPipeline;
import win.ixuni.strata.core.pipeline.PipelineSettings;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Abstract base class for units of work
 * <p>
 * Holds the lifecycle shared by every driver: the transaction state machine, the collection registry, the
 * decorator pipeline and the commit retry loop. Subclasses open the store session in their constructor and
 * provide raw collections.
 */
public abstract class AbstractUnitOfWork implements UnitOfWork {

    protected final Logger logger;

    @Getter
    protected final EntityCache cache;

    @Getter
    protected final ILoggerFactory loggerFactory;

    @Getter
    protected final UnitOfWorkOptions options;

    @Getter
    protected final CollectionRegistry registry = new CollectionRegistry();

    private final CollectionPipeline pipeline;

    private final AtomicReference<TransactionState> state = new AtomicReference<>(TransactionState.STARTED);

    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractUnitOfWork(EntityCache cache, ILoggerFactory loggerFactory, UnitOfWorkOptions options) {
        if (options == null) {
            throw new ConfigurationException("Unit of work options are required");
        }
        this.cache = cache;
        this.loggerFactory = loggerFactory;
        this.options = options;
        this.logger = loggerFactory.getLogger(getClass().getName());
        this.pipeline = new CollectionPipeline(PipelineSettings.builder()
                .cache(cache)
                .cacheEnabled(options.isCacheEnabled() && cache != null)
                .actorId(options.getActorId())
                .logTime(options.isLogTime())
                .logger(logger)
                .stateCheck(this::ensureStarted)
                .build());
    }

    /**
     * Narrow the options to the variant a driver needs
     *
     * @throws ConfigurationException when the options are of another variant
     */
    protected static <O extends UnitOfWorkOptions> O requireOptions(UnitOfWorkOptions options, Class<O> type) {
        if (!type.isInstance(options)) {
            throw new ConfigurationException("Options should be of type " + type.getSimpleName()
                    + (options == null ? ", got null" : ", got " + options.getClass().getSimpleName()));
        }
        return type.cast(options);
    }

    /**
     * Session whose transaction this unit of work controls
     */
    protected abstract TransactionSession session();

    /**
     * Create the undecorated driver collection of a type
     */
    protected abstract <T extends StoredEntity> EntityCollection<T> createCollection(EntityType<T> type);

    /**
     * Release driver resources (session, client); called once from {@link #close()}
     */
    protected abstract void release();

    @Override
    public <T extends StoredEntity> EntityCollection<T> getCollection(EntityType<T> type) {
        ensureStarted();
        return registry.resolve(type, () -> pipeline.wrap(createCollection(type)));
    }

    @Override
    public Mono<Void> commit() {
        return Mono.defer(() -> {
            ensureStarted();
            return Mono.defer(() -> session().commitTransaction())
                    .retryWhen(commitRetry(options.getCommitRetry()))
                    .doOnSuccess(ignored -> {
                        transition(TransactionState.COMMITTED);
                        logger.info("Transaction committed.");
                    })
                    .doOnError(error -> {
                        transition(TransactionState.FAILED);
                        logger.error("Error during commit: {}.", error.getMessage());
                    });
        });
    }

    private Retry commitRetry(CommitRetrySettings settings) {
        return Retry.backoff(settings.getMaxRetries(), settings.getMinBackoff())
                .maxBackoff(settings.getMaxBackoff())
                .filter(AmbiguousCommitException.class::isInstance)
                .doBeforeRetry(signal -> logger.warn("Commit result unknown ({}), retrying commit operation, attempt {}",
                        signal.failure().getMessage(), signal.totalRetries() + 2))
                .onRetryExhaustedThrow((spec, signal) ->
                        new CommitRetryExhaustedException(signal.totalRetries() + 1, signal.failure()));
    }

    @Override
    public Mono<Void> abort() {
        return Mono.defer(() -> {
            ensureStarted();
            return session().abortTransaction()
                    .doOnSuccess(ignored -> {
                        transition(TransactionState.ABORTED);
                        logger.info("Transaction aborted.");
                    })
                    .doOnError(error -> transition(TransactionState.FAILED));
        });
    }

    @Override
    public TransactionState getState() {
        return state.get();
    }

    @Override
    public String getActorId() {
        return options.getActorId();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (state.get() == TransactionState.STARTED) {
                abort().block();
            }
        } finally {
            release();
        }
    }

    protected void ensureStarted() {
        TransactionState current = state.get();
        if (current != TransactionState.STARTED) {
            throw new IllegalTransactionStateException(current);
        }
    }

    private void transition(TransactionState next) {
        state.compareAndSet(TransactionState.STARTED, next);
    }
}
