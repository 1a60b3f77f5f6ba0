package win.ixuni.strata.driver.mongodb.collection;

import com.mongodb.client.model.Filters;
import org.bson.Document;
import org.bson.conversions.Bson;
import win.ixuni.strata.core.model.EntityFilter;
import win.ixuni.strata.core.util.EntityMapper;

import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entity, document and filter conversion for MongoDB
 * <p>
 * The entity {@code id} is stored as {@code _id}; temporal values are stored in their ISO string form, the
 * same form {@link EntityMapper} writes.
 */
public final class MongoDocuments {

    static final String ENTITY_ID = "id";
    static final String MONGO_ID = "_id";

    private MongoDocuments() {
    }

    public static Document toDocument(Object entity) {
        Map<String, Object> fields = EntityMapper.toDocument(entity);
        Document document = new Document();
        Object id = fields.remove(ENTITY_ID);
        if (id != null) {
            document.put(MONGO_ID, id);
        }
        document.putAll(fields);
        return document;
    }

    public static <T> T fromDocument(Document document, Class<T> type) {
        Map<String, Object> fields = new LinkedHashMap<>(document);
        Object id = fields.remove(MONGO_ID);
        if (id != null) {
            fields.put(ENTITY_ID, id.toString());
        }
        return EntityMapper.fromDocument(fields, type);
    }

    public static Bson byId(String id) {
        return Filters.eq(MONGO_ID, id);
    }

    /**
     * Translate a field filter into a MongoDB query
     */
    public static Bson toBson(EntityFilter filter) {
        if (filter.isEmpty()) {
            return new Document();
        }
        List<Bson> conditions = new ArrayList<>();
        for (EntityFilter.Condition condition : filter.getConditions()) {
            String field = ENTITY_ID.equals(condition.field()) ? MONGO_ID : condition.field();
            conditions.add(switch (condition.operator()) {
                case EQ -> Filters.eq(field, toBsonValue(condition.value()));
                case NE -> Filters.ne(field, toBsonValue(condition.value()));
                case IN -> Filters.in(field, ((Collection<?>) condition.value()).stream()
                        .map(MongoDocuments::toBsonValue)
                        .toList());
            });
        }
        return conditions.size() == 1 ? conditions.get(0) : Filters.and(conditions);
    }

    private static Object toBsonValue(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        if (value instanceof TemporalAccessor) {
            return value.toString();
        }
        return value;
    }
}
