package win.ixuni.strata.core.collection.decorator;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

/**
 * Transaction state guard
 * <p>
 * Runs the owning unit of work's state check at subscription of every operation, so a collection held past
 * commit or abort fails instead of reaching the cache or a session without a transaction.
 *
 * @param <T> entity type
 */
public class TransactionGuardCollection<T extends StoredEntity> extends ForwardingEntityCollection<T> {

    private final Runnable stateCheck;

    /**
     * @param stateCheck throws when the transaction is no longer started
     */
    public TransactionGuardCollection(EntityCollection<T> delegate, Runnable stateCheck) {
        super(delegate);
        this.stateCheck = stateCheck;
    }

    @Override
    public Mono<T> create(T entity) {
        return guarded(() -> delegate.create(entity));
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return guardedMany(() -> delegate.createAll(entities));
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return guarded(() -> delegate.findById(id, mode));
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return guardedMany(() -> delegate.find(filter, mode));
    }

    @Override
    public Mono<T> update(T entity) {
        return guarded(() -> delegate.update(entity));
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return guardedMany(() -> delegate.updateAll(entities));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return guarded(() -> delegate.delete(id));
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return guarded(() -> delegate.deleteAll(ids));
    }

    private <R> Mono<R> guarded(Supplier<Mono<R>> call) {
        return Mono.defer(() -> {
            stateCheck.run();
            return call.get();
        });
    }

    private <R> Flux<R> guardedMany(Supplier<Flux<R>> call) {
        return Flux.defer(() -> {
            stateCheck.run();
            return call.get();
        });
    }
}
