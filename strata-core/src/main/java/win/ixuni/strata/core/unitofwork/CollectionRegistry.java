package win.ixuni.strata.core.unitofwork;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Collection registry
 * <p>
 * Maps entity types to the composed collection of one unit of work. Entries are built on first request and never
 * replaced, so repeated resolution returns the same instance. Lookup and insertion are a single atomic step per
 * type: concurrent first requests build the pipeline once.
 */
@Slf4j
public class CollectionRegistry {

    private final Map<EntityType<?>, EntityCollection<?>> collections = new ConcurrentHashMap<>();

    /**
     * Get the collection of a type, building it on first use
     *
     * @param type    entity type
     * @param factory builds the collection; called at most once per type
     * @param <T>     entity type
     * @return the registered collection
     */
    @SuppressWarnings("unchecked")
    public <T extends StoredEntity> EntityCollection<T> resolve(EntityType<T> type,
                                                                Supplier<EntityCollection<T>> factory) {
        return (EntityCollection<T>) collections.computeIfAbsent(type, key -> {
            EntityCollection<T> collection = factory.get();
            log.debug("Registered collection for {}", type);
            return collection;
        });
    }

    public boolean contains(EntityType<?> type) {
        return collections.containsKey(type);
    }

    public int size() {
        return collections.size();
    }
}
