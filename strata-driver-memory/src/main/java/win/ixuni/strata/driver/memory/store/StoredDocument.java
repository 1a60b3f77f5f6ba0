package win.ixuni.strata.driver.memory.store;

import java.util.Map;

/**
 * Committed document with its version
 * <p>
 * Version 0 stands for "never written"; every committed write increments it, removals included.
 * A removed document keeps its version with null fields.
 */
public record StoredDocument(long version, Map<String, Object> fields) {

    public boolean isTombstone() {
        return fields == null;
    }
}
