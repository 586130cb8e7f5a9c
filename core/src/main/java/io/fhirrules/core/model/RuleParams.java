package io.fhirrules.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleConfigurationException;
import io.fhirrules.core.path.PathExpression;
import io.fhirrules.core.path.Predicate;
import io.fhirrules.core.path.PredicateParser;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Type-specific parameters of a {@link Rule}. One record per {@link RuleType};
 * each validates itself on construction and throws
 * {@link RuleConfigurationException} for anything missing or out of range.
 */
public sealed interface RuleParams {

    /** The rule type these params belong to. */
    RuleType type();

    // ── Variants ──

    /** Required has no params. */
    record RequiredParams() implements RuleParams {
        @Override
        public RuleType type() {
            return RuleType.REQUIRED;
        }
    }

    /**
     * @param value the expected literal: a string, number or boolean node
     */
    record FixedValueParams(JsonNode value) implements RuleParams {
        public FixedValueParams {
            if (value == null || value.isNull() || value.isMissingNode()) {
                throw new RuleConfigurationException("FixedValue requires a 'value'", null);
            }
            if (!value.isTextual() && !value.isNumber() && !value.isBoolean()) {
                throw new RuleConfigurationException(
                        "FixedValue 'value' must be a string, number or boolean, got " + value.getNodeType(), null);
            }
        }

        @Override
        public RuleType type() {
            return RuleType.FIXED_VALUE;
        }
    }

    /**
     * @param values the allowed values, non-empty, no blanks
     */
    record AllowedValuesParams(List<String> values) implements RuleParams {
        public AllowedValuesParams {
            if (values == null || values.isEmpty()) {
                throw new RuleConfigurationException("AllowedValues requires a non-empty 'values' list", null);
            }
            for (String v : values) {
                if (v == null || v.isBlank()) {
                    throw new RuleConfigurationException("AllowedValues 'values' must not contain blanks", null);
                }
            }
            values = List.copyOf(values);
        }

        @Override
        public RuleType type() {
            return RuleType.ALLOWED_VALUES;
        }
    }

    /**
     * @param pattern         a {@link Pattern} expression, searched with
     *                        {@code find()}
     * @param negate          fail when the pattern is found instead of when it
     *                        is not
     * @param caseInsensitive match ignoring case
     */
    record RegexParams(String pattern, boolean negate, boolean caseInsensitive) implements RuleParams {
        public RegexParams {
            if (pattern == null || pattern.isEmpty()) {
                throw new RuleConfigurationException("Regex requires a 'pattern'", null);
            }
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new RuleConfigurationException("Regex 'pattern' does not compile: " + e.getDescription(), e, null);
            }
        }

        /** Compiles the pattern with the configured flags. */
        public Pattern compiled() {
            return caseInsensitive
                    ? Pattern.compile(pattern, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE)
                    : Pattern.compile(pattern);
        }

        @Override
        public RuleType type() {
            return RuleType.REGEX;
        }
    }

    /**
     * At least one bound is required.
     *
     * @param min minimum cardinality or {@code null}
     * @param max maximum cardinality or {@code null}
     */
    record ArrayLengthParams(Integer min, Integer max) implements RuleParams {
        public ArrayLengthParams {
            if (min == null && max == null) {
                throw new RuleConfigurationException("ArrayLength requires at least one of 'min' or 'max'", null);
            }
            if ((min != null && min < 0) || (max != null && max < 0)) {
                throw new RuleConfigurationException("ArrayLength bounds must be >= 0", null);
            }
            if (min != null && max != null && min > max) {
                throw new RuleConfigurationException(
                        "ArrayLength 'min' (" + min + ") must not exceed 'max' (" + max + ")", null);
            }
        }

        @Override
        public RuleType type() {
            return RuleType.ARRAY_LENGTH;
        }
    }

    /**
     * @param system the required code system URI
     * @param codes  allowed codes within the system; empty allows any code
     */
    record CodeSystemParams(String system, List<String> codes) implements RuleParams {
        public CodeSystemParams {
            if (system == null || system.isBlank()) {
                throw new RuleConfigurationException("CodeSystem requires a 'system'", null);
            }
            codes = codes == null ? List.of() : List.copyOf(codes);
        }

        @Override
        public RuleType type() {
            return RuleType.CODE_SYSTEM;
        }
    }

    /**
     * @param expression a boolean predicate in the constrained predicate grammar
     */
    record CustomExpressionParams(String expression) implements RuleParams {
        public CustomExpressionParams {
            if (expression == null || expression.isBlank()) {
                throw new RuleConfigurationException("CustomExpression requires an 'expression'", null);
            }
            try {
                PredicateParser.parse(expression);
            } catch (InvalidPathExpressionException e) {
                throw new RuleConfigurationException(
                        "CustomExpression 'expression' is invalid: " + e.getMessage(), e, null);
            }
        }

        /** Parses the expression. */
        public Predicate predicate() {
            return PredicateParser.parse(expression);
        }

        @Override
        public RuleType type() {
            return RuleType.CUSTOM_EXPRESSION;
        }
    }

    /**
     * @param requirements     declared requirements, at least one, with no two
     *                         targeting the same type and filters
     * @param rejectUndeclared whether an instance of a type with no requirement
     *                         is itself a failure
     */
    record ResourceCompositionParams(List<ResourceRequirement> requirements, boolean rejectUndeclared)
            implements RuleParams {
        public ResourceCompositionParams {
            if (requirements == null || requirements.isEmpty()) {
                throw new RuleConfigurationException("ResourceComposition requires at least one requirement", null);
            }
            Set<String> seen = new HashSet<>();
            for (ResourceRequirement r : requirements) {
                Objects.requireNonNull(r, "requirement must not be null");
                if (!seen.add(r.targetKey())) {
                    throw new RuleConfigurationException(
                            "ResourceComposition declares '" + r.resourceType() + "' twice with the same filters",
                            null);
                }
            }
            requirements = List.copyOf(requirements);
        }

        /** Whether any requirement targets the given resource type. */
        public boolean declares(String resourceType) {
            return requirements.stream().anyMatch(r -> r.resourceType().equals(resourceType));
        }

        @Override
        public RuleType type() {
            return RuleType.RESOURCE_COMPOSITION;
        }
    }

    /**
     * @param questionSetId id of the referenced {@link QuestionSet}
     * @param iterationPath resource-relative path of the repeating structure,
     *                      e.g. {@code component}
     * @param questionPath  path of the question Coding inside one iteration
     *                      node, e.g. {@code code.coding}
     * @param answerPath    path of the answer inside one iteration node, e.g.
     *                      {@code value}
     * @param constraint    the constraint to check
     */
    record QuestionAnswerParams(
            String questionSetId,
            PathExpression iterationPath,
            PathExpression questionPath,
            PathExpression answerPath,
            AnswerConstraint constraint)
            implements RuleParams {
        public QuestionAnswerParams {
            if (questionSetId == null || questionSetId.isBlank()) {
                throw new RuleConfigurationException("QuestionAnswer requires a 'questionSetId'", null);
            }
            if (iterationPath == null || questionPath == null || answerPath == null) {
                throw new RuleConfigurationException(
                        "QuestionAnswer requires 'iterationPath', 'questionPath' and 'answerPath'", null);
            }
            if (constraint == null) {
                throw new RuleConfigurationException("QuestionAnswer requires a 'constraint'", null);
            }
        }

        @Override
        public RuleType type() {
            return RuleType.QUESTION_ANSWER;
        }
    }
}
