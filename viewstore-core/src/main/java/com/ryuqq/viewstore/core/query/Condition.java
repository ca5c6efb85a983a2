package com.ryuqq.viewstore.core.query;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Node of a filter's condition tree.
 *
 * <p>{@link Custom} wraps opaque code and makes the enclosing filter non-serializable; every
 * other node has a query-string form.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public sealed interface Condition<T>
    permits Condition.Comparison, Condition.And, Condition.Or, Condition.Not, Condition.Custom {

    /**
     * Evaluates the condition.
     *
     * @param item the item
     * @param tree memoized tree form of the item
     * @return match flag
     */
    boolean test(T item, Supplier<JsonNode> tree);

    boolean isSerializable();

    /**
     * Property comparison.
     *
     * @param property property path as written by the caller
     * @param pointer compiled path
     * @param operator comparison operator
     * @param operand operand in tree form
     */
    record Comparison<T>(String property, JsonPointer pointer, Operator operator, JsonNode operand)
        implements Condition<T> {

        public Comparison {
            if (property == null || pointer == null || operator == null || operand == null) {
                throw new IllegalArgumentException("comparison components cannot be null");
            }
        }

        @Override
        public boolean test(T item, Supplier<JsonNode> tree) {
            return operator.evaluate(tree.get().at(pointer), operand);
        }

        @Override
        public boolean isSerializable() {
            return true;
        }
    }

    record And<T>(List<Condition<T>> conditions) implements Condition<T> {

        public And {
            conditions = List.copyOf(conditions);
        }

        @Override
        public boolean test(T item, Supplier<JsonNode> tree) {
            for (Condition<T> condition : conditions) {
                if (!condition.test(item, tree)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public boolean isSerializable() {
            return conditions.stream().allMatch(Condition::isSerializable);
        }
    }

    record Or<T>(List<Condition<T>> conditions) implements Condition<T> {

        public Or {
            conditions = List.copyOf(conditions);
        }

        @Override
        public boolean test(T item, Supplier<JsonNode> tree) {
            for (Condition<T> condition : conditions) {
                if (condition.test(item, tree)) {
                    return true;
                }
            }
            return false;
        }

        @Override
        public boolean isSerializable() {
            return conditions.stream().allMatch(Condition::isSerializable);
        }
    }

    record Not<T>(Condition<T> condition) implements Condition<T> {

        public Not {
            if (condition == null) {
                throw new IllegalArgumentException("condition cannot be null");
            }
        }

        @Override
        public boolean test(T item, Supplier<JsonNode> tree) {
            return !condition.test(item, tree);
        }

        @Override
        public boolean isSerializable() {
            return condition.isSerializable();
        }
    }

    record Custom<T>(Predicate<? super T> predicate) implements Condition<T> {

        public Custom {
            if (predicate == null) {
                throw new IllegalArgumentException("predicate cannot be null");
            }
        }

        @Override
        public boolean test(T item, Supplier<JsonNode> tree) {
            return predicate.test(item);
        }

        @Override
        public boolean isSerializable() {
            return false;
        }
    }
}
