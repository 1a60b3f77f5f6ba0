package win.ixuni.strata.driver.mongodb.collection;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoWriteException;
import com.mongodb.reactivestreams.client.ClientSession;
import com.mongodb.reactivestreams.client.MongoCollection;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.strata.core.collection.EntityCollection;
import win.ixuni.strata.core.exception.EntityAlreadyExistsException;
import win.ixuni.strata.core.exception.EntityNotFoundException;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.model.EntityType;
import win.ixuni.strata.core.model.ReadMode;
import win.ixuni.strata.core.model.StoredEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Raw MongoDB collection
 * <p>
 * Every call runs on the unit of work's client session, inside its transaction. The read mode is not
 * interpreted here.
 *
 * @param <T> entity type
 */
@Slf4j
public class MongoEntityCollection<T extends StoredEntity> implements EntityCollection<T> {

    @Getter
    private final EntityType<T> entityType;
    private final MongoCollection<Document> collection;
    private final ClientSession session;

    public MongoEntityCollection(EntityType<T> entityType, MongoCollection<Document> collection,
                                 ClientSession session) {
        this.entityType = entityType;
        this.collection = collection;
        this.session = session;
    }

    @Override
    public Mono<T> create(T entity) {
        return Mono.defer(() -> {
            assignId(entity);
            return Mono.from(collection.insertOne(session, MongoDocuments.toDocument(entity)));
        })
                .onErrorMap(this::isDuplicateKey, e -> new EntityAlreadyExistsException(name(), entity.getId()))
                .thenReturn(entity);
    }

    @Override
    public Flux<T> createAll(List<T> entities) {
        if (entities.isEmpty()) {
            return Flux.empty();
        }
        return Mono.defer(() -> {
            List<Document> documents = new ArrayList<>(entities.size());
            for (T entity : entities) {
                assignId(entity);
                documents.add(MongoDocuments.toDocument(entity));
            }
            return Mono.from(collection.insertMany(session, documents));
        })
                .doOnNext(result -> log.debug("[{}] Inserted {} document(s)", name(), result.getInsertedIds().size()))
                .onErrorMap(this::isDuplicateKey, e -> new EntityAlreadyExistsException(name(), "(bulk)"))
                .thenMany(Flux.fromIterable(entities));
    }

    @Override
    public Mono<T> findById(String id, ReadMode mode) {
        return Mono.from(collection.find(session, MongoDocuments.byId(id)).first())
                .map(document -> MongoDocuments.fromDocument(document, entityType.getEntityClass()));
    }

    @Override
    public Flux<T> find(EntityFilter filter, ReadMode mode) {
        return Flux.from(collection.find(session, MongoDocuments.toBson(filter)))
                .map(document -> MongoDocuments.fromDocument(document, entityType.getEntityClass()));
    }

    @Override
    public Mono<Long> count(EntityFilter filter, ReadMode mode) {
        return Mono.from(collection.countDocuments(session, MongoDocuments.toBson(filter)));
    }

    @Override
    public Mono<T> update(T entity) {
        return Mono.defer(() -> {
            if (entity.getId() == null) {
                return Mono.error(new EntityNotFoundException(name(), "null"));
            }
            return Mono.from(collection.replaceOne(session, MongoDocuments.byId(entity.getId()),
                    MongoDocuments.toDocument(entity)));
        })
                .flatMap(result -> result.getMatchedCount() == 0
                        ? Mono.error(new EntityNotFoundException(name(), entity.getId()))
                        : Mono.just(entity));
    }

    @Override
    public Flux<T> updateAll(List<T> entities) {
        return Flux.fromIterable(entities).concatMap(this::update);
    }

    @Override
    public Mono<Boolean> delete(String id) {
        return Mono.from(collection.deleteOne(session, MongoDocuments.byId(id)))
                .map(result -> result.getDeletedCount() > 0);
    }

    @Override
    public Mono<Long> deleteAll(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Mono.just(0L);
        }
        return Mono.from(collection.deleteMany(session, MongoDocuments.toBson(EntityFilter.in("id", ids))))
                .map(result -> result.getDeletedCount());
    }

    private void assignId(T entity) {
        if (entity.getId() == null) {
            entity.setId(UUID.randomUUID().toString());
        }
    }

    private boolean isDuplicateKey(Throwable error) {
        if (error instanceof MongoWriteException writeError) {
            return writeError.getError().getCategory() == ErrorCategory.DUPLICATE_KEY;
        }
        if (error instanceof MongoBulkWriteException bulkError) {
            return bulkError.getWriteErrors().stream()
                    .anyMatch(writeError -> ErrorCategory.fromErrorCode(writeError.getCode()) == ErrorCategory.DUPLICATE_KEY);
        }
        return false;
    }

    private String name() {
        return entityType.getCollectionName();
    }
}
