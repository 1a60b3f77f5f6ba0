package win.ixuni.strata.core.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import win.ixuni.strata.core.exception.EntityMappingException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entity to document conversion
 * <p>
 * Documents are plain field maps. Null fields are left out, so a field added to an entity class after a record
 * was stored shows up as missing; unknown document fields are ignored when reading back.
 */
public final class EntityMapper {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final TypeReference<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private EntityMapper() {
    }

    public static Map<String, Object> toDocument(Object entity) {
        try {
            return MAPPER.convertValue(entity, DOCUMENT_TYPE);
        } catch (IllegalArgumentException e) {
            throw new EntityMappingException("Failed to convert " + entity.getClass().getSimpleName() + " to document", e);
        }
    }

    public static <T> T fromDocument(Map<String, Object> document, Class<T> type) {
        try {
            return MAPPER.convertValue(document, type);
        } catch (IllegalArgumentException e) {
            throw new EntityMappingException("Failed to convert document to " + type.getSimpleName(), e);
        }
    }

    /**
     * Deep copy through the document form
     */
    @SuppressWarnings("unchecked")
    public static <T> T copy(T entity) {
        return fromDocument(toDocument(entity), (Class<T>) entity.getClass());
    }
}
