package win.ixuni.strata.driver.memory.collection;

import lombok.Getter;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.exception.EntityAlreadyExistsException;
import win.ixuni.strata.core.exception.EntityNotFoundException;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;
import win.ixuni.strata.core.util.EntityMapper;
import win.ixuni.strata.driver.memory.session.MemoryTransactionSession;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Raw in-memory collection
 * <p>
 * Stores entities as documents inside the session's transaction. The read mode is not interpreted here; soft
 * deleted records are returned like any other.
 *
 * @param <T> entity type
 */
public class MemoryEntityCollection<T extends StoredEntity> implements EntityCollection<T> {

    @Getter
    private final EntityType<T> entityType;
    private final MemoryTransactionSession session;

    public MemoryEntityCollection(EntityType<T> entityType, MemoryTransactionSession session) {
        this.entityType = entityType;
        this.session = session;
    }

    @Override
    public Mono<T> create(T entity) {
        return Mono.fromCallable(() -> {
            if (entity.getId() == null) {
                entity.setId(UUID.randomUUID().toString());
            }
            if (session.exists(name(), entity.getId())) {
                throw new EntityAlreadyExistsException(name(), entity.getId());
            }
            session.write(name(), entity.getId(), EntityMapper.toDocument(entity));
            return entity;
        });
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        return Flux.fromIterable(entities).concatMap(this::create);
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return Mono.defer(() -> Mono.justOrEmpty(session.read(name(), id)))
                .map(this::toEntity);
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return Flux.defer(() -> Flux.fromIterable(session.scan(name())))
                .filter(filter::matches)
                .map(this::toEntity);
    }

    @Override
    public Mono<Long> count(EntityFilter filter, ReadMode mode) {
        return find(filter, mode).count();
    }

    @Override
    public Mono<T> update(T entity) {
        return Mono.fromCallable(() -> {
            if (entity.getId() == null || !session.exists(name(), entity.getId())) {
                throw new EntityNotFoundException(name(), String.valueOf(entity.getId()));
            }
            session.write(name(), entity.getId(), EntityMapper.toDocument(entity));
            return entity;
        });
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return Flux.fromIterable(entities).concatMap(this::update);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.fromCallable(() -> session.remove(name(), id));
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        return Flux.fromIterable(ids)
                .concatMap(this::delete)
                .filter(Boolean::booleanValue)
                .count();
    }

    private T toEntity(Map<String, Object> document) {
        return EntityMapper.fromDocument(document, entityType.getEntityClass());
    }

    private String name() {
        return entityType.getCollectionName();
    }
}
