package win.ixuni.strata.core.model;

import lombok.Getter;

import java.util.Objects;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Default value of one entity field
 * <p>
 * Applied when the field is {@code null} after loading, i.e. the stored document predates the field.
 *
 * @param <T> entity type
 * @param <V> field type
 */
public final class FieldDefault<T, V> {

    @Getter
    private final String fieldName;
    private final Function<T, V> getter;
    private final BiConsumer<T, V> setter;
    private final Supplier<? extends V> value;

    FieldDefault(String fieldName, Function<T, V> getter, BiConsumer<T, V> setter, Supplier<? extends V> value) {
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        this.getter = Objects.requireNonNull(getter, "getter");
        this.setter = Objects.requireNonNull(setter, "setter");
        this.value = Objects.requireNonNull(value, "value");
    }

    /**
     * Backfill the field if it is missing
     *
     * @param entity entity to fill in place
     * @return true when the default was written
     */
    public boolean applyTo(T entity) {
        if (getter.apply(entity) != null) {
            return false;
        }
        setter.accept(entity, value.get());
        return true;
    }
}
