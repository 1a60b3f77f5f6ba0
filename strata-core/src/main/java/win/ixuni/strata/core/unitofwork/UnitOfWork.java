package win.ixuni.strata.core.unitofwork;

import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;

/**
 * Unit of work
 * <p>
 * Owns one store session with an open transaction for the duration of one business operation, and hands out
 * decorated collections that all operate inside that transaction. Create one per operation, then either
 * {@link #commit()} or {@link #abort()} it.
 *
 * <pre>
 * try (UnitOfWork uow = factory.create(cache, loggerFactory, options)) {
 *     EntityCollection&lt;Book&gt; books = uow.getCollection(BOOKS);
 *     books.create(book).block();
 *     uow.commit().block();
 * }
 * </pre>
 */
public interface UnitOfWork extends AutoCloseable {

    /**
     * Get the collection of an entity type
     * <p>
     * The first call builds the decorated collection; later calls return the identical instance.
     *
     * @param type entity type
     * @param <T>  entity type
     * @return the collection bound to this unit of work
     */
    <T extends StoredEntity> EntityCollection<T> getCollection(EntityType<T> type);

    /**
     * Commit the transaction
     * <p>
     * Commits whose outcome the store cannot confirm are retried; any other failure is raised and leaves the
     * transaction {@link TransactionState#FAILED}.
     */
    Mono<Void> commit();

    /**
     * Roll the transaction back with a single request; failures are raised as they are
     */
    Mono<Void> abort();

    TransactionState getState();

    /**
     * Qualified database identifier, {@code "<databaseName>-<qualifier>"}
     */
    String getDatabaseId();

    /**
     * Identity attributed to mutations made through this unit of work
     */
    String getActorId();

    /**
     * Abort a transaction that is still started, then release the session
     */
    @Override
    void close();
}
