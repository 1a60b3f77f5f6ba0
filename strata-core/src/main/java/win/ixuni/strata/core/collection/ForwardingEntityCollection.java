package win.ixuni.strata.core.collection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Collection decorator base
 * <p>
 * Forwards every operation to the wrapped collection. Decorators override only the operations of the concern they
 * own.
 *
 * @param <T> entity type
 */
public abstract class ForwardingEntityCollection<T extends StoredEntity> implements EntityCollection<T> {

    protected final EntityCollection<T> delegate;

    protected ForwardingEntityCollection(EntityCollection<T> delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public EntityCollection<T> getDelegate() {
        return delegate;
    }

    protected String collectionName() {
        return getEntityType().getCollectionName();
    }

    @Override
    public EntityType<T> getEntityType() {
        return delegate.getEntityType();
    }

    @Override
    public Mono<T> create(T entity) {
        return delegate.create(entity);
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return delegate.createAll(entities);
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return delegate.findById(id, mode);
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return delegate.find(filter, mode);
    }

    @Override
    public Mono<T> update(T entity) {
        return delegate.update(entity);
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return delegate.updateAll(entities);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return delegate.delete(id);
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return delegate.deleteAll(ids);
    }
}
