package win.ixuni.strata.core.model;

import lombok.Getter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Field filter for collection reads
 * <p>
 * A conjunction of simple field conditions. Drivers either evaluate it against stored documents
 * ({@link #matches(Map)}) or translate the conditions into their native query form.
 * An empty filter matches every record.
 */
public final class EntityFilter {

    private static final EntityFilter ALL = new EntityFilter(Collections.emptyList());

    @Getter
    private final List<Condition> conditions;

    private EntityFilter(List<Condition> conditions) {
        this.conditions = conditions;
    }

    public static EntityFilter all() {
        return ALL;
    }

    public static EntityFilter eq(String field, Object value) {
        return ALL.and(field, Operator.EQ, value);
    }

    public static EntityFilter ne(String field, Object value) {
        return ALL.and(field, Operator.NE, value);
    }

    public static EntityFilter in(String field, Collection<?> values) {
        return ALL.and(field, Operator.IN, List.copyOf(values));
    }

    public EntityFilter andEq(String field, Object value) {
        return and(field, Operator.EQ, value);
    }

    public EntityFilter andNe(String field, Object value) {
        return and(field, Operator.NE, value);
    }

    public EntityFilter andIn(String field, Collection<?> values) {
        return and(field, Operator.IN, List.copyOf(values));
    }

    private EntityFilter and(String field, Operator operator, Object value) {
        List<Condition> next = new ArrayList<>(conditions);
        next.add(new Condition(Objects.requireNonNull(field, "field"), operator, value));
        return new EntityFilter(Collections.unmodifiableList(next));
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    /**
     * Evaluate against a stored document
     *
     * @param document field name to value; a missing field reads as null
     * @return true when every condition holds
     */
    public boolean matches(Map<String, Object> document) {
        for (Condition condition : conditions) {
            if (!condition.matches(document.get(condition.field()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return conditions.isEmpty() ? "EntityFilter(all)" : "EntityFilter" + conditions;
    }

    public enum Operator {
        EQ, NE, IN
    }

    /**
     * Condition on a single field
     */
    public record Condition(String field, Operator operator, Object value) {

        boolean matches(Object actual) {
            return switch (operator) {
                case EQ -> valueEquals(actual, value);
                case NE -> !valueEquals(actual, value);
                case IN -> ((Collection<?>) value).stream().anyMatch(candidate -> valueEquals(actual, candidate));
            };
        }

        private static boolean valueEquals(Object actual, Object expected) {
            if (actual instanceof Number a && expected instanceof Number e) {
                return new BigDecimal(a.toString()).compareTo(new BigDecimal(e.toString())) == 0;
            }
            if (actual instanceof Enum<?> a && expected instanceof String) {
                return a.name().equals(expected);
            }
            if (expected instanceof Enum<?> e) {
                return e.name().equals(actual);
            }
            return Objects.equals(actual, expected);
        }
    }
}
