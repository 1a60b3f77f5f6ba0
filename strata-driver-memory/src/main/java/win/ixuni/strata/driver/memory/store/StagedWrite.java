package win.ixuni.strata.driver.memory.store;

import java.util.Map;

/**
 * Uncommitted write of one document
 *
 * @param baseVersion committed version the transaction first read or wrote against
 * @param fields      new document, null for a removal
 */
public record StagedWrite(long baseVersion, Map<String, Object> fields) {
}
