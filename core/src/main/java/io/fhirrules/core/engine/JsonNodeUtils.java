package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;

/**
 * Shared JSON node helpers for rule and predicate evaluation.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class JsonNodeUtils {

    private JsonNodeUtils() {}

    /**
     * Whether a value counts as absent: {@code null}, missing, JSON null, a
     * blank string, or an empty array or object.
     */
    public static boolean isBlank(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return true;
        }
        if (node.isTextual()) {
            return node.asText().isBlank();
        }
        if (node.isContainerNode()) {
            return node.isEmpty();
        }
        return false;
    }

    /**
     * Type-aware equality between a record value and a literal: numbers compare
     * numerically, booleans as booleans, strings as strings. A value of a
     * different kind than the literal is never equal.
     */
    public static boolean valueEquals(JsonNode value, JsonNode literal) {
        return compare(value, literal) == 0;
    }

    /**
     * Type-aware ordering between a record value and a literal.
     *
     * @return the comparison result, or {@link Integer#MIN_VALUE} if the two
     *         are of incomparable kinds
     */
    public static int compare(JsonNode value, JsonNode literal) {
        if (value == null || literal == null) {
            return Integer.MIN_VALUE;
        }
        if (literal.isNumber()) {
            BigDecimal number = numberOf(value);
            return number == null ? Integer.MIN_VALUE : Integer.signum(number.compareTo(literal.decimalValue()));
        }
        if (literal.isBoolean()) {
            return value.isBoolean() ? Boolean.compare(value.booleanValue(), literal.booleanValue()) : Integer.MIN_VALUE;
        }
        if (literal.isTextual()) {
            return value.isTextual() ? Integer.signum(value.asText().compareTo(literal.asText())) : Integer.MIN_VALUE;
        }
        return Integer.MIN_VALUE;
    }

    /**
     * The numeric value of a node: a JSON number, or the {@code value} of a
     * Quantity object. {@code null} otherwise.
     */
    public static BigDecimal numberOf(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isObject() && node.path("value").isNumber()) {
            return node.get("value").decimalValue();
        }
        return null;
    }

    /** Text of a scalar node, or {@code null} for containers and absent nodes. */
    public static String scalarText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }
}
