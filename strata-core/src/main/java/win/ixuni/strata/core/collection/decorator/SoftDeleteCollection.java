package win.ixuni.strata.core.collection.decorator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.util.EntityMapper;

import java.util.Collection;
import java.util.LinkedHashSet;

/**
 * Soft delete decorator
 * <p>
 * A delete becomes an update that sets the {@code deleted} flag; records are never removed physically by this
 * layer. Reads hide flagged records unless {@link ReadMode#INCLUDE_DELETED} is requested.
 *
 * @param <T> entity type
 */
@Slf4j
public class SoftDeleteCollection<T extends StoredEntity> extends ForwardingEntityCollection<T> {

    public SoftDeleteCollection(EntityCollection<T> delegate) {
        super(delegate);
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return delegate.findById(id, mode)
                .filter(entity -> isVisible(entity, mode));
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return delegate.find(filter, mode)
                .filter(entity -> isVisible(entity, mode));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return delegate.findById(id, ReadMode.INCLUDE_DELETED)
                .filter(entity -> !entity.isDeleted())
                .map(this::flagged)
                .flatMap(delegate::update)
                .doOnNext(entity -> log.debug("[{}] Soft-deleted {}", collectionName(), id))
                .map(entity -> true)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return Flux.fromIterable(new LinkedHashSet<>(ids))
                .concatMap(id -> delegate.findById(id, ReadMode.INCLUDE_DELETED))
                .filter(entity -> !entity.isDeleted())
                .map(this::flagged)
                .collectList()
                .flatMapMany(entities -> entities.isEmpty() ? Flux.<T>empty() : delegate.updateAll(entities))
                .count();
    }

    private boolean isVisible(T entity, ReadMode mode) {
        return mode == ReadMode.INCLUDE_DELETED || !entity.isDeleted();
    }

    /**
     * Flag a copy so a shared instance (e.g. a cached one) is not changed before the update succeeds
     */
    private T flagged(T entity) {
        T copy = EntityMapper.copy(entity);
        copy.setDeleted(true);
        return copy;
    }
}
