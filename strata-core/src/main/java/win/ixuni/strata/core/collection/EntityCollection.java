package win.ixuni.strata.core.collection;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.Collection;
import java.util.List;

/**
 * Collection of one entity type
 * <p>
 * Implemented by the raw driver collections and by every decorator layered on top of them, so callers cannot
 * tell how many layers sit between them and the store. All operations run inside the transaction of the unit of
 * work that resolved the collection.
 *
 * @param <T> entity type
 */
public interface EntityCollection<T extends StoredEntity> {

    EntityType<T> getEntityType();

    /**
     * Insert a new entity
     *
     * @param entity entity to insert; an id is generated when absent
     * @return the stored entity
     */
    Mono<T> create(T entity);

    Flux<T> createAll(List<T> entities);

    /**
     * Read one entity, hiding soft-deleted records
     *
     * @param id entity id
     * @return the entity, empty when not found
     */
    default Mono<T> findById(String id) {
        return findById(id, ReadMode.ACTIVE);
    }

    Mono<T> findById(String id, ReadMode mode);

    default Flux<T> find(EntityFilter filter) {
        return find(filter, ReadMode.ACTIVE);
    }

    Flux<T> find(EntityFilter filter, ReadMode mode);

    default Mono<Long> count(EntityFilter filter) {
        return count(filter, ReadMode.ACTIVE);
    }

    default Mono<Long> count(EntityFilter filter, ReadMode mode) {
        return find(filter, mode).count();
    }

    /**
     * Replace an existing entity
     *
     * @return the stored entity
     */
    Mono<T> update(T entity);

    Flux<T> updateAll(List<T> entities);

    /**
     * Delete one entity
     *
     * @return true when a record was deleted
     */
    Mono<Boolean> delete(String id);

    /**
     * @return number of records deleted
     */
    Mono<Long> deleteAll(Collection<String> ids);
}
