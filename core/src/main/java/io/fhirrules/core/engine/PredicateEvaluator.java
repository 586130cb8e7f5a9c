package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import io.fhirrules.core.model.ScopeFilter;
import io.fhirrules.core.path.Predicate;
import java.math.BigDecimal;
import java.util.List;

/**
 * Evaluates {@link Predicate}s and {@link ScopeFilter}s against a resource.
 *
 * <p>
 * Comparisons are existential: {@code path op literal} holds if any selected
 * value satisfies it. {@code !=} is the exception and holds if no selected
 * value equals the literal, so it is true when the path selects nothing.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PredicateEvaluator {

    private PredicateEvaluator() {}

    /** Evaluates a predicate with {@code context} as the root of every path. */
    public static boolean test(Predicate predicate, JsonNode context) {
        if (predicate instanceof Predicate.Or or) {
            return or.operands().stream().anyMatch(p -> test(p, context));
        }
        if (predicate instanceof Predicate.And and) {
            return and.operands().stream().allMatch(p -> test(p, context));
        }
        if (predicate instanceof Predicate.Not not) {
            return !test(not.operand(), context);
        }
        if (predicate instanceof Predicate.Exists exists) {
            return nonBlank(RecordNavigator.values(context, exists.path())) > 0;
        }
        if (predicate instanceof Predicate.Empty empty) {
            return nonBlank(RecordNavigator.values(context, empty.path())) == 0;
        }
        if (predicate instanceof Predicate.Count count) {
            int n = RecordNavigator.values(context, count.path()).size();
            return count.operator().test(BigDecimal.valueOf(n).compareTo(count.value()));
        }
        Predicate.Compare compare = (Predicate.Compare) predicate;
        List<JsonNode> values = RecordNavigator.values(context, compare.path());
        if (compare.operator() == Predicate.Operator.NE) {
            return values.stream().noneMatch(v -> JsonNodeUtils.valueEquals(v, compare.literal()));
        }
        return values.stream().anyMatch(v -> {
            int c = JsonNodeUtils.compare(v, compare.literal());
            return c != Integer.MIN_VALUE && compare.operator().test(c);
        });
    }

    /** Evaluates a scope filter with {@code resource} as the root of its path. */
    public static boolean matches(ScopeFilter filter, JsonNode resource) {
        List<JsonNode> values = RecordNavigator.values(resource, filter.fieldPath());
        return switch (filter.comparison()) {
            case EXISTS -> nonBlank(values) > 0;
            case NOT_EXISTS -> nonBlank(values) == 0;
            case EQUALS -> values.stream().anyMatch(v -> textEquals(v, filter.literal()));
            case NOT_EQUALS -> values.stream().noneMatch(v -> textEquals(v, filter.literal()));
            case CONTAINS -> values.stream().anyMatch(v -> {
                String text = JsonNodeUtils.scalarText(v);
                return text != null && text.contains(filter.literal());
            });
            case IN -> values.stream().anyMatch(v -> filter.literalValues().stream().anyMatch(l -> textEquals(v, l)));
        };
    }

    private static boolean textEquals(JsonNode value, String literal) {
        String text = JsonNodeUtils.scalarText(value);
        if (text == null) {
            return false;
        }
        if (value.isNumber()) {
            try {
                return JsonNodeUtils.valueEquals(value, DecimalNode.valueOf(new BigDecimal(literal)));
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return text.equals(literal);
    }

    private static long nonBlank(List<JsonNode> values) {
        return values.stream().filter(v -> !JsonNodeUtils.isBlank(v)).count();
    }
}
