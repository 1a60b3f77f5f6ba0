package win.ixuni.strata.core.collection.decorator;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.collection.ForwardingEntityCollection;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Default value decorator
 * <p>
 * Backfills the defaults declared on the entity type into every entity read or written, so records stored before
 * a field existed come back complete. Create and update paths are also stamped with the acting identity and the
 * modification time.
 *
 * @param <T> entity type
 */
@Slf4j
public class DefaultValueCollection<T extends StoredEntity> extends ForwardingEntityCollection<T> {

    private final String actorId;
    private final Clock clock;

    public DefaultValueCollection(EntityCollection<T> delegate, String actorId, Clock clock) {
        super(delegate);
        this.actorId = actorId;
        this.clock = clock;
    }

    @Override
    public Mono<T> create(T entity) {
        return Mono.defer(() -> delegate.create(prepareCreate(entity, clock.instant())))
                .map(this::backfill);
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            entities.forEach(entity -> prepareCreate(entity, now));
            return delegate.createAll(entities);
        }).map(this::backfill);
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return delegate.findById(id, mode).map(this::backfill);
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return delegate.find(filter, mode).map(this::backfill);
    }

    @Override
    public Mono<T> update(T entity) {
        return Mono.defer(() -> delegate.update(prepareUpdate(entity, clock.instant())))
                .map(this::backfill);
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            entities.forEach(entity -> prepareUpdate(entity, now));
            return delegate.updateAll(entities);
        }).map(this::backfill);
    }

    private T prepareCreate(T entity, Instant now) {
        if (entity.getCreated() == null) {
            entity.setCreated(now);
        }
        return prepareUpdate(entity, now);
    }

    private T prepareUpdate(T entity, Instant now) {
        entity.setLastModified(now);
        entity.setLastModifiedBy(actorId);
        return backfill(entity);
    }

    private T backfill(T entity) {
        int filled = getEntityType().applyDefaults(entity);
        if (filled > 0) {
            log.debug("[{}] Backfilled {} default value(s) into {}", collectionName(), filled, entity.getId());
        }
        return entity;
    }
}
