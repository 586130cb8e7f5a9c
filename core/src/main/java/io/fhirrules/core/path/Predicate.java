package io.fhirrules.core.path;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Parsed boolean predicate of the constrained predicate grammar, produced by
 * {@link PredicateParser}. Paths are relative to the evaluation context.
 */
public sealed interface Predicate {

    /** Comparison operators. */
    enum Operator {
        EQ("="),
        NE("!="),
        GT(">"),
        GE(">="),
        LT("<"),
        LE("<=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /** Applies the operator to a {@code compareTo} result. */
        public boolean test(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case NE -> comparison != 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
            };
        }

        static Operator fromSymbol(String symbol) {
            for (Operator o : values()) {
                if (o.symbol.equals(symbol)) {
                    return o;
                }
            }
            throw new IllegalArgumentException("Unknown operator '" + symbol + "'");
        }
    }

    // ── Variants ──

    /** True if any operand is true. */
    record Or(List<Predicate> operands) implements Predicate {
        public Or {
            operands = List.copyOf(operands);
        }
    }

    /** True if every operand is true. */
    record And(List<Predicate> operands) implements Predicate {
        public And {
            operands = List.copyOf(operands);
        }
    }

    /** Negation. */
    record Not(Predicate operand) implements Predicate {
        public Not {
            Objects.requireNonNull(operand, "operand must not be null");
        }
    }

    /** {@code path.exists()}: at least one non-empty value. */
    record Exists(PathExpression path) implements Predicate {}

    /** {@code path.empty()}: no non-empty value. */
    record Empty(PathExpression path) implements Predicate {}

    /** {@code path.count() op n}. */
    record Count(PathExpression path, Operator operator, BigDecimal value) implements Predicate {}

    /**
     * {@code path op literal}: true if any selected value satisfies the
     * comparison. The literal is a text, number or boolean node.
     */
    record Compare(PathExpression path, Operator operator, JsonNode literal) implements Predicate {}
}
