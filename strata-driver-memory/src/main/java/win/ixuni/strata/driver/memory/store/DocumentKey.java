package win.ixuni.strata.driver.memory.store;

/**
 * Collection name plus document id
 */
public record DocumentKey(String collection, String id) {
}
