package win.ixuni.strata.driver.memory.session;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.exception.IllegalTransactionStateException;
import win.ixuni.strata.core.unitofwork.TransactionSession;
import win.ixuni.strata.core.unitofwork.TransactionState;
import win.ixuni.strata.driver.memory.store.DocumentKey;
import win.ixuni.strata.driver.memory.store.MemoryDatabase;
import win.ixuni.strata.driver.memory.store.StagedWrite;
import win.ixuni.strata.driver.memory.store.StoredDocument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory transaction session
 * <p>
 * Writes are staged per transaction and only become visible to other sessions on commit. Reads see committed
 * documents overlaid with this session's own staged writes. The first version observed for each document, by a
 * read or a write, is the one its commit is checked against.
 */
@Slf4j
public class MemoryTransactionSession implements TransactionSession {

    @Getter
    private final MemoryDatabase database;

    private final Map<DocumentKey, StagedWrite> staged = new LinkedHashMap<>();

    /**
     * First committed version observed per document
     */
    private final Map<DocumentKey, Long> observed = new HashMap<>();

    private TransactionState state = TransactionState.STARTED;

    public MemoryTransactionSession(MemoryDatabase database) {
        this.database = database;
    }

    public synchronized Optional<Map<String, Object>> read(String collection, String id) {
        ensureStarted();
        DocumentKey key = new DocumentKey(collection, id);
        StagedWrite write = staged.get(key);
        if (write != null) {
            return Optional.ofNullable(write.fields());
        }
        Optional<StoredDocument> document = database.lookup(collection, id);
        observed.putIfAbsent(key, document.map(StoredDocument::version).orElse(0L));
        return document.filter(stored -> !stored.isTombstone()).map(StoredDocument::fields);
    }

    public boolean exists(String collection, String id) {
        return read(collection, id).isPresent();
    }

    /**
     * Committed documents of a collection merged with the staged writes of this session
     */
    public synchronized List<Map<String, Object>> scan(String collection) {
        ensureStarted();
        Map<String, Map<String, Object>> merged = new LinkedHashMap<>();
        for (StoredDocument document : database.scan(collection)) {
            String id = String.valueOf(document.fields().get("id"));
            observed.putIfAbsent(new DocumentKey(collection, id), document.version());
            merged.put(id, document.fields());
        }
        staged.forEach((key, write) -> {
            if (!key.collection().equals(collection)) {
                return;
            }
            if (write.fields() == null) {
                merged.remove(key.id());
            } else {
                merged.put(key.id(), write.fields());
            }
        });
        return new ArrayList<>(merged.values());
    }

    public synchronized void write(String collection, String id, Map<String, Object> fields) {
        stage(new DocumentKey(collection, id), Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    /**
     * @return true when a visible document was removed
     */
    public synchronized boolean remove(String collection, String id) {
        if (!exists(collection, id)) {
            return false;
        }
        stage(new DocumentKey(collection, id), null);
        return true;
    }

    private void stage(DocumentKey key, Map<String, Object> fields) {
        ensureStarted();
        StagedWrite previous = staged.get(key);
        long baseVersion = previous != null
                ? previous.baseVersion()
                : observed.computeIfAbsent(key, k -> database.versionOf(k.collection(), k.id()));
        staged.put(key, new StagedWrite(baseVersion, fields));
    }

    public synchronized int pendingWrites() {
        return staged.size();
    }

    @Override
    public Mono<Void> commitTransaction() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                ensureStarted();
                database.apply(staged);
                log.debug("[{}] Committed {} staged write(s)", database.getName(), staged.size());
                staged.clear();
                observed.clear();
                state = TransactionState.COMMITTED;
            }
        });
    }

    @Override
    public Mono<Void> abortTransaction() {
        return Mono.fromRunnable(() -> {
            synchronized (this) {
                ensureStarted();
                staged.clear();
                observed.clear();
                state = TransactionState.ABORTED;
            }
        });
    }

    @Override
    public synchronized void close() {
        if (state == TransactionState.STARTED) {
            staged.clear();
            observed.clear();
            state = TransactionState.ABORTED;
        }
    }

    private void ensureStarted() {
        if (state != TransactionState.STARTED) {
            throw new IllegalTransactionStateException(state);
        }
    }
}
