package com.ryuqq.viewstore.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.util.JsonNodes;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Item predicate, either a structured condition tree over property paths or opaque code.
 *
 * <p>Filters are immutable; every builder call returns a new filter. Consecutive builder calls
 * conjoin:</p>
 * <pre>
 * Filter&lt;Task&gt; open = store.createFilter()
 *     .equalTo("status", "OPEN")
 *     .greaterThan("priority", 2);
 * Filter&lt;Task&gt; either = open.or(store.createFilter().in("owner", "kim", "lee"));
 * </pre>
 *
 * <p>Property paths are dot paths ({@code "a.b"}) or JSON pointers ({@code "/a/b"}), resolved
 * against the item's tree form. A filter with no condition matches every item.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Filter<T> implements Query<T> {

    private final ItemMapper<T> mapper;
    private final Condition<T> condition;

    private Filter(ItemMapper<T> mapper, Condition<T> condition) {
        this.mapper = mapper;
        this.condition = condition;
    }

    /**
     * Match-all filter to build property conditions on.
     *
     * @param mapper item mapper resolving property paths
     * @param <T> item type
     * @return empty filter
     */
    public static <T> Filter<T> where(ItemMapper<T> mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        return new Filter<>(mapper, null);
    }

    /**
     * Opaque filter. It has no query-string form.
     *
     * @param predicate item predicate
     * @param <T> item type
     * @return custom filter
     */
    public static <T> Filter<T> custom(Predicate<? super T> predicate) {
        return new Filter<>(null, new Condition.Custom<>(predicate));
    }

    /**
     * Opaque filter that can still be combined with property conditions.
     *
     * @param mapper item mapper for later property conditions
     * @param predicate item predicate
     * @param <T> item type
     * @return custom filter
     */
    public static <T> Filter<T> custom(ItemMapper<T> mapper, Predicate<? super T> predicate) {
        return new Filter<>(mapper, new Condition.Custom<>(predicate));
    }

    /**
     * Property equal to a value (JSON-aware: {@code 1} equals {@code 1.0}).
     *
     * @param path dot path or JSON pointer
     * @param value compared value
     * @return conjoined filter
     * @throws IllegalArgumentException if path is null
     */
    public Filter<T> equalTo(String path, Object value) {
        return compare(path, Operator.EQ, value);
    }

    /**
     * @param path dot path or JSON pointer
     * @param value compared value
     * @return conjoined filter
     */
    public Filter<T> notEqualTo(String path, Object value) {
        return compare(path, Operator.NE, value);
    }

    /**
     * Property ordered before a value. Missing and null properties order first.
     *
     * @param path dot path or JSON pointer
     * @param value bound
     * @return conjoined filter
     */
    public Filter<T> lessThan(String path, Object value) {
        return compare(path, Operator.LT, value);
    }

    public Filter<T> lessThanOrEqualTo(String path, Object value) {
        return compare(path, Operator.LE, value);
    }

    /**
     * Property ordered after a value.
     *
     * @param path dot path or JSON pointer
     * @param value bound
     * @return conjoined filter
     */
    public Filter<T> greaterThan(String path, Object value) {
        return compare(path, Operator.GT, value);
    }

    public Filter<T> greaterThanOrEqualTo(String path, Object value) {
        return compare(path, Operator.GE, value);
    }

    /**
     * Property equal to one of the values.
     *
     * @param path dot path or JSON pointer
     * @param values candidates
     * @return conjoined filter
     * @throws IllegalArgumentException if values is null
     */
    public Filter<T> in(String path, Collection<?> values) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        ArrayNode operand = requireMapper().objectMapper().createArrayNode();
        for (Object value : values) {
            operand.add(toOperand(value));
        }
        return and(new Condition.Comparison<>(path, JsonNodes.pointer(path), Operator.IN, operand));
    }

    public Filter<T> in(String path, Object... values) {
        return in(path, Arrays.asList(values));
    }

    /**
     * Array property containing an element equal to {@code value}, or text property containing
     * {@code value} as a substring.
     *
     * @param path property path
     * @param value element or substring
     * @return conjoined filter
     */
    public Filter<T> contains(String path, Object value) {
        return compare(path, Operator.CONTAINS, value);
    }

    /**
     * Text property matching a regular expression anywhere.
     *
     * @param path property path
     * @param regex java.util.regex syntax
     * @return conjoined filter
     * @throws IllegalArgumentException if the expression does not compile
     */
    public Filter<T> matches(String path, String regex) {
        if (regex == null) {
            throw new IllegalArgumentException("regex cannot be null");
        }
        try {
            Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid regex: " + regex, e);
        }
        return compare(path, Operator.MATCHES, regex);
    }

    /**
     * Conjunction with another filter.
     *
     * @param other the other filter
     * @return filter matching items both match
     * @throws IllegalArgumentException if other is null
     */
    public Filter<T> and(Filter<T> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (other.condition == null) {
            return new Filter<>(mapperOr(other), condition);
        }
        return new Filter<>(mapperOr(other), conjoin(condition, other.condition));
    }

    /**
     * Disjunction with another filter.
     *
     * @param other the other filter
     * @return filter matching items either matches
     * @throws IllegalArgumentException if other is null
     */
    public Filter<T> or(Filter<T> other) {
        if (other == null) {
            throw new IllegalArgumentException("other cannot be null");
        }
        if (condition == null || other.condition == null) {
            // one side matches everything
            return new Filter<>(mapperOr(other), null);
        }
        List<Condition<T>> parts = new ArrayList<>();
        addDisjunct(parts, condition);
        addDisjunct(parts, other.condition);
        return new Filter<>(mapperOr(other), new Condition.Or<>(parts));
    }

    /**
     * @return filter matching exactly the items this one rejects
     */
    public Filter<T> not() {
        if (condition == null) {
            return new Filter<>(mapper, new Condition.Custom<>(item -> false));
        }
        return new Filter<>(mapper, new Condition.Not<>(condition));
    }

    /**
     * Evaluates this filter on one item.
     *
     * @param item the item
     * @return match flag
     */
    public boolean test(T item) {
        if (condition == null) {
            return true;
        }
        return condition.test(item, treeOf(item));
    }

    @Override
    public QueryType kind() {
        return QueryType.FILTER;
    }

    @Override
    public List<T> apply(List<T> data) {
        List<T> result = new ArrayList<>(data.size());
        for (T item : data) {
            if (test(item)) {
                result.add(item);
            }
        }
        return result;
    }

    @Override
    public boolean isSerializable() {
        return condition == null || condition.isSerializable();
    }

    @Override
    public String toQueryString(QuerySerializer serializer) {
        return serializer.serializeFilter(this);
    }

    /**
     * Root of the condition tree.
     *
     * @return the condition, or null for a match-all filter
     */
    public Condition<T> condition() {
        return condition;
    }

    public boolean isEmpty() {
        return condition == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Filter && Objects.equals(condition, ((Filter<?>) o).condition);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(condition);
    }

    @Override
    public String toString() {
        return "Filter[" + condition + "]";
    }

    private Filter<T> compare(String path, Operator operator, Object value) {
        return and(new Condition.Comparison<>(path, JsonNodes.pointer(path), operator, toOperand(value)));
    }

    private Filter<T> and(Condition<T> next) {
        requireMapper();
        return new Filter<>(mapper, conjoin(condition, next));
    }

    private JsonNode toOperand(Object value) {
        return value instanceof JsonNode ? (JsonNode) value : requireMapper().toNode(value);
    }

    private Supplier<JsonNode> treeOf(T item) {
        JsonNode[] tree = new JsonNode[1];
        return () -> {
            if (tree[0] == null) {
                tree[0] = requireMapper().toTree(item);
            }
            return tree[0];
        };
    }

    private ItemMapper<T> requireMapper() {
        if (mapper == null) {
            throw new IllegalStateException("property conditions need an item mapper; build the filter from Filter.where(mapper)");
        }
        return mapper;
    }

    private ItemMapper<T> mapperOr(Filter<T> other) {
        return mapper != null ? mapper : other.mapper;
    }

    private static <T> Condition<T> conjoin(Condition<T> left, Condition<T> right) {
        if (left == null) {
            return right;
        }
        List<Condition<T>> parts = new ArrayList<>();
        if (left instanceof Condition.And) {
            parts.addAll(((Condition.And<T>) left).conditions());
        } else {
            parts.add(left);
        }
        if (right instanceof Condition.And) {
            parts.addAll(((Condition.And<T>) right).conditions());
        } else {
            parts.add(right);
        }
        return new Condition.And<>(parts);
    }

    private static <T> void addDisjunct(List<Condition<T>> parts, Condition<T> condition) {
        if (condition instanceof Condition.Or) {
            parts.addAll(((Condition.Or<T>) condition).conditions());
        } else {
            parts.add(condition);
        }
    }
}
