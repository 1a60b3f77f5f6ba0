package win.ixuni.strata.driver.memory.store;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.strata.core.exception.CommitFailedException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One named in-memory database
 * <p>
 * Collections map document ids to committed documents. Transactions apply their writes through
 * {@link #apply(Map)}, which checks every written document against the version the transaction read.
 * A removal leaves a tombstone so the version of an id keeps increasing across delete and re-create.
 */
@Slf4j
public class MemoryDatabase {

    @Getter
    private final String name;

    /**
     * Collection name -> (id -> document)
     */
    private final Map<String, Map<String, StoredDocument>> collections = new ConcurrentHashMap<>();

    public MemoryDatabase(String name) {
        this.name = name;
    }

    /**
     * Live document of an id, tombstones excluded
     */
    public Optional<StoredDocument> get(String collection, String id) {
        return lookup(collection, id).filter(document -> !document.isTombstone());
    }

    /**
     * Stored entry of an id, tombstones included
     */
    public Optional<StoredDocument> lookup(String collection, String id) {
        return Optional.ofNullable(collection(collection).get(id));
    }

    public long versionOf(String collection, String id) {
        StoredDocument document = collection(collection).get(id);
        return document != null ? document.version() : 0L;
    }

    /**
     * Snapshot of the live documents of a collection
     */
    public List<StoredDocument> scan(String collection) {
        List<StoredDocument> documents = new ArrayList<>();
        for (StoredDocument document : collection(collection).values()) {
            if (!document.isTombstone()) {
                documents.add(document);
            }
        }
        return documents;
    }

    /**
     * Apply the writes of one transaction atomically
     *
     * @param writes staged writes; a null document removes the record
     * @throws CommitFailedException when another transaction committed one of the documents first
     */
    public synchronized void apply(Map<DocumentKey, StagedWrite> writes) {
        for (Map.Entry<DocumentKey, StagedWrite> entry : writes.entrySet()) {
            DocumentKey key = entry.getKey();
            long current = versionOf(key.collection(), key.id());
            if (current != entry.getValue().baseVersion()) {
                throw new CommitFailedException("Write conflict on " + key.collection() + "/" + key.id()
                        + ": expected version " + entry.getValue().baseVersion() + ", found " + current, null);
            }
        }
        for (Map.Entry<DocumentKey, StagedWrite> entry : writes.entrySet()) {
            DocumentKey key = entry.getKey();
            Map<String, Object> fields = entry.getValue().fields();
            long next = entry.getValue().baseVersion() + 1;
            collection(key.collection()).put(key.id(),
                    new StoredDocument(next, fields == null ? null : Collections.unmodifiableMap(fields)));
        }
        log.debug("[{}] Applied {} write(s)", name, writes.size());
    }

    /**
     * Write a document outside of any transaction (seeding, migration tests)
     */
    public synchronized void put(String collection, String id, Map<String, Object> fields) {
        long next = versionOf(collection, id) + 1;
        collection(collection).put(id, new StoredDocument(next, Collections.unmodifiableMap(fields)));
    }

    public int size(String collection) {
        return scan(collection).size();
    }

    private Map<String, StoredDocument> collection(String collection) {
        return collections.computeIfAbsent(collection, key -> new ConcurrentHashMap<>());
    }
}
