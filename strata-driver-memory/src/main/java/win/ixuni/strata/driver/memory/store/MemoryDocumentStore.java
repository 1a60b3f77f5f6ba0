package win.ixuni.strata.driver.memory.store;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory document store
 * <p>
 * Holds named databases for the lifetime of the process. The default instance is shared by every memory unit of
 * work created without an explicit store.
 */
public class MemoryDocumentStore {

    private static final MemoryDocumentStore DEFAULT = new MemoryDocumentStore();

    private final Map<String, MemoryDatabase> databases = new ConcurrentHashMap<>();

    public static MemoryDocumentStore getDefault() {
        return DEFAULT;
    }

    /**
     * Get a database, creating it on first use
     */
    public MemoryDatabase getDatabase(String name) {
        return databases.computeIfAbsent(name, MemoryDatabase::new);
    }

    public boolean hasDatabase(String name) {
        return databases.containsKey(name);
    }
}
