package com.ryuqq.viewstore.core.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.viewstore.core.util.JsonNodes;

import java.util.regex.Pattern;

/**
 * Comparison operators of property conditions.
 *
 * <p>Ordering operators are false when the property is absent or null, or when the property
 * and the operand are of different kinds (number, text, boolean).</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public enum Operator {

    EQ {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return JsonNodes.valueEquals(actual, operand);
        }
    },
    NE {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return !JsonNodes.valueEquals(actual, operand);
        }
    },
    LT {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return comparable(actual, operand) && JsonNodes.compare(actual, operand) < 0;
        }
    },
    LE {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return comparable(actual, operand) && JsonNodes.compare(actual, operand) <= 0;
        }
    },
    GT {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return comparable(actual, operand) && JsonNodes.compare(actual, operand) > 0;
        }
    },
    GE {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return comparable(actual, operand) && JsonNodes.compare(actual, operand) >= 0;
        }
    },
    /** operand is an array of candidates. */
    IN {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            for (JsonNode candidate : operand) {
                if (JsonNodes.valueEquals(actual, candidate)) {
                    return true;
                }
            }
            return false;
        }
    },
    /** array membership, or substring for text. */
    CONTAINS {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            if (actual.isArray()) {
                for (JsonNode element : actual) {
                    if (JsonNodes.valueEquals(element, operand)) {
                        return true;
                    }
                }
                return false;
            }
            return actual.isTextual() && operand.isTextual() && actual.textValue().contains(operand.textValue());
        }
    },
    /** operand is a regular expression, matched anywhere in the text. */
    MATCHES {
        @Override
        boolean evaluate(JsonNode actual, JsonNode operand) {
            return actual.isTextual() && Pattern.compile(operand.asText()).matcher(actual.textValue()).find();
        }
    };

    /**
     * Evaluates the operator.
     *
     * @param actual property value ({@code MissingNode} when absent)
     * @param operand condition operand
     * @return match flag
     */
    abstract boolean evaluate(JsonNode actual, JsonNode operand);

    private static boolean comparable(JsonNode a, JsonNode b) {
        if (JsonNodes.isAbsent(a) || JsonNodes.isAbsent(b)) {
            return false;
        }
        return (a.isNumber() && b.isNumber())
            || (a.isTextual() && b.isTextual())
            || (a.isBoolean() && b.isBoolean());
    }
}
