package com.ryuqq.viewstore.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.viewstore.core.error.NotSerializableQueryException;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.StringJoiner;

/**
 * Default query-string format, in RQL style.
 *
 * <p><strong>Forms:</strong></p>
 * <ul>
 *   <li>{@code eq(v,1)}, {@code ne}, {@code lt}, {@code le}, {@code gt}, {@code ge}</li>
 *   <li>{@code in(v,(1,2))}, {@code contains(tags,a)}, {@code match(name,%5Ea)}</li>
 *   <li>{@code and(..,..)}, {@code or(..,..)}, {@code not(..)}</li>
 *   <li>{@code sort(+v)} / {@code sort(-v)}, {@code limit(count,start)}</li>
 * </ul>
 *
 * <p>Property paths are written in dot form; string operands are URL-encoded. A match-all
 * filter serializes to the empty string.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class RqlQuerySerializer implements QuerySerializer {

    public static final RqlQuerySerializer INSTANCE = new RqlQuerySerializer();

    @Override
    public String serializeFilter(Filter<?> filter) {
        if (filter.isEmpty()) {
            return "";
        }
        return condition(filter.condition());
    }

    @Override
    public String serializeSort(Sort<?> sort) {
        if (!sort.isSerializable()) {
            throw new NotSerializableQueryException("Sort by comparator has no query-string form");
        }
        return "sort(" + (sort.isDescending() ? "-" : "+") + dotPath(sort.property()) + ")";
    }

    @Override
    public String serializeRange(Range<?> range) {
        return "limit(" + range.count() + "," + range.start() + ")";
    }

    private <T> String condition(Condition<T> condition) {
        if (condition instanceof Condition.Comparison) {
            Condition.Comparison<T> comparison = (Condition.Comparison<T>) condition;
            return name(comparison.operator()) + "(" + dotPath(comparison.property()) + ","
                + operand(comparison.operand()) + ")";
        }
        if (condition instanceof Condition.And) {
            return "and(" + join(((Condition.And<T>) condition).conditions()) + ")";
        }
        if (condition instanceof Condition.Or) {
            return "or(" + join(((Condition.Or<T>) condition).conditions()) + ")";
        }
        if (condition instanceof Condition.Not) {
            return "not(" + condition(((Condition.Not<T>) condition).condition()) + ")";
        }
        throw new NotSerializableQueryException("Filter with a custom predicate has no query-string form");
    }

    private <T> String join(List<Condition<T>> conditions) {
        StringJoiner joiner = new StringJoiner(",");
        for (Condition<T> condition : conditions) {
            joiner.add(condition(condition));
        }
        return joiner.toString();
    }

    private static String name(Operator operator) {
        switch (operator) {
            case EQ:
                return "eq";
            case NE:
                return "ne";
            case LT:
                return "lt";
            case LE:
                return "le";
            case GT:
                return "gt";
            case GE:
                return "ge";
            case IN:
                return "in";
            case CONTAINS:
                return "contains";
            case MATCHES:
                return "match";
            default:
                throw new IllegalStateException("Unknown operator: " + operator);
        }
    }

    private static String operand(JsonNode value) {
        if (value.isArray()) {
            StringJoiner joiner = new StringJoiner(",", "(", ")");
            for (JsonNode element : value) {
                joiner.add(operand(element));
            }
            return joiner.toString();
        }
        if (value.isTextual()) {
            return encode(value.textValue());
        }
        if (value.isNull() || value.isMissingNode()) {
            return "null";
        }
        if (value.isObject()) {
            return encode(value.toString());
        }
        return value.asText();
    }

    private static String encode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8).replace("+", "%20");
    }

    static String dotPath(String path) {
        if (!path.startsWith("/")) {
            return path;
        }
        return path.substring(1).replace('/', '.').replace("~1", "/").replace("~0", "~");
    }
}
