package win.ixuni.strata.core.cache;

import java.util.Optional;

/**
 * Entity cache capability
 * <p>
 * One instance is usually shared by every unit of work of a process, so implementations must be thread-safe.
 * Eviction and expiry are up to the implementation.
 */
public interface EntityCache {

    /**
     * Look up an entry
     *
     * @param key  cache key
     * @param type expected value type
     * @return the cached value, empty on a miss or when the entry has another type
     */
    <T> Optional<T> get(CacheKey key, Class<T> type);

    void put(CacheKey key, Object value);

    void invalidate(CacheKey key);

    /**
     * Drop every entry
     */
    void clear();
}
