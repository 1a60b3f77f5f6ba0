package win.ixuni.strata.core.collection.decorator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.cache.CacheKey;
import win.ixuni.strata.core.cache.EntityCache;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.util.EntityMapper;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Read cache decorator
 * <p>
 * Reads by id are served from the entity cache when possible; a miss reads through and stores the result.
 * Every successful write invalidates the entries of the ids it touched. When disabled, all calls pass straight
 * through.
 * <p>
 * The cache is shared between units of work, so it never holds an instance a caller can see: a miss stores a
 * backfilled copy and every hit returns a fresh copy.
 *
 * @param <T> entity type
 */
@Slf4j
public class CachingCollection<T extends StoredEntity> extends ForwardingEntityCollection<T> {

    private final EntityCache cache;
    private final boolean enabled;

    public CachingCollection(EntityCollection<T> delegate, EntityCache cache, boolean enabled) {
        super(delegate);
        if (enabled && cache == null) {
            throw new IllegalArgumentException("An entity cache is required when caching is enabled");
        }
        this.cache = cache;
        this.enabled = enabled;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public Mono<T> create(T entity) {
        return delegate.create(entity)
                .doOnNext(created -> invalidate(created.getId()));
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return delegate.createAll(entities)
                .doOnNext(created -> invalidate(created.getId()));
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        if (!enabled) {
            return delegate.findById(id, mode);
        }
        return Mono.defer(() -> {
            CacheKey key = key(id);
            Optional<T> cached = cache.get(key, getEntityType().getEntityClass());
            if (cached.isPresent()) {
                log.trace("Cache hit: {}", key);
                return Mono.just(EntityMapper.copy(cached.get()));
            }
            log.trace("Cache miss: {}", key);
            return delegate.findById(id, mode)
                    .doOnNext(entity -> cache.put(key, snapshot(entity)));
        });
    }

    @Override
    public Mono<T> update(T entity) {
        return delegate.update(entity)
                .doOnNext(updated -> invalidate(updated.getId()));
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return delegate.updateAll(entities)
                .doOnNext(updated -> invalidate(updated.getId()));
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return delegate.delete(id)
                .doOnSuccess(deleted -> invalidate(id));
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return delegate.deleteAll(ids)
                .doOnSuccess(count -> ids.forEach(this::invalidate));
    }

    private T snapshot(T entity) {
        T copy = EntityMapper.copy(entity);
        getEntityType().applyDefaults(copy);
        return copy;
    }

    private void invalidate(String id) {
        if (enabled && id != null) {
            cache.invalidate(key(id));
        }
    }

    private CacheKey key(String id) {
        return new CacheKey(collectionName(), id);
    }
}
