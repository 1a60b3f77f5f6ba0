package win.ixuni.strata.core.cache;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process entity cache backed by a {@link ConcurrentHashMap}
 * <p>
 * Entries are never evicted, which suits single-process use and tests.
 */
@Slf4j
public class MemoryEntityCache implements EntityCache {

    private final Map<CacheKey, Object> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(CacheKey key, Class<T> type) {
        Object value = entries.get(key);
        if (!type.isInstance(value)) {
            return Optional.empty();
        }
        return Optional.of(type.cast(value));
    }

    @Override
    public void put(CacheKey key, Object value) {
        if (value == null) {
            entries.remove(key);
            return;
        }
        entries.put(key, value);
    }

    @Override
    public void invalidate(CacheKey key) {
        if (entries.remove(key) != null) {
            log.trace("Invalidated cache entry: {}", key);
        }
    }

    @Override
    public void clear() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }
}
