package win.ixuni.strata.core.cache;

/**
 * Cache key of one entity: collection name plus identifier
 */
public record CacheKey(String collectionName, String id) {

    @Override
    public String toString() {
        return collectionName + "/" + id;
    }
}
