package win.ixuni.strata.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Entity type descriptor
 * <p>
 * The type tag used to resolve collections from a unit of work. It names the backing collection and
 * declares the defaults used to backfill records written before a field existed.
 * <p>
 * Usage example:
 *
 * <pre>
 * EntityType&lt;Book&gt; BOOKS = EntityType.builder(Book.class)
 *         .collectionName("books")
 *         .defaultValue("edition", Book::getEdition, Book::setEdition, () -&gt; "v2")
 *         .build();
 * </pre>
 *
 * Two descriptors are equal when they share entity class and collection name.
 *
 * @param <T> entity type
 */
public final class EntityType<T extends StoredEntity> {

    private final Class<T> entityClass;
    private final String collectionName;
    private final List<FieldDefault<T, ?>> defaults;

    private EntityType(Builder<T> builder) {
        this.entityClass = builder.entityClass;
        this.collectionName = builder.collectionName != null
                ? builder.collectionName
                : builder.entityClass.getSimpleName();
        this.defaults = Collections.unmodifiableList(new ArrayList<>(builder.defaults));
    }

    /**
     * Descriptor without defaults, named after the class
     */
    public static <T extends StoredEntity> EntityType<T> of(Class<T> entityClass) {
        return builder(entityClass).build();
    }

    public static <T extends StoredEntity> Builder<T> builder(Class<T> entityClass) {
        return new Builder<>(entityClass);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public List<FieldDefault<T, ?>> getDefaults() {
        return defaults;
    }

    /**
     * Backfill every declared default missing from the entity
     *
     * @return number of fields written
     */
    public int applyDefaults(T entity) {
        int filled = 0;
        for (FieldDefault<T, ?> fieldDefault : defaults) {
            if (fieldDefault.applyTo(entity)) {
                filled++;
            }
        }
        return filled;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EntityType<?> other)) {
            return false;
        }
        return entityClass.equals(other.entityClass) && collectionName.equals(other.collectionName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityClass, collectionName);
    }

    @Override
    public String toString() {
        return "EntityType(" + entityClass.getSimpleName() + " -> " + collectionName + ")";
    }

    public static final class Builder<T extends StoredEntity> {

        private final Class<T> entityClass;
        private String collectionName;
        private final List<FieldDefault<T, ?>> defaults = new ArrayList<>();

        private Builder(Class<T> entityClass) {
            this.entityClass = Objects.requireNonNull(entityClass, "entityClass");
        }

        public Builder<T> collectionName(String collectionName) {
            this.collectionName = collectionName;
            return this;
        }

        public <V> Builder<T> defaultValue(String fieldName, Function<T, V> getter, BiConsumer<T, V> setter,
                                           Supplier<? extends V> value) {
            defaults.add(new FieldDefault<>(fieldName, getter, setter, value));
            return this;
        }

        public EntityType<T> build() {
            return new EntityType<>(this);
        }
    }
}
