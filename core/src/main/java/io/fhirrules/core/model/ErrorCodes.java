package io.fhirrules.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed error-code vocabulary. Rule types with a fixed code map to exactly one
 * constant; {@link RuleType#CUSTOM_EXPRESSION} picks from
 * {@link #GOVERNED_CUSTOM_CODES}; {@link RuleType#QUESTION_ANSWER} derives its
 * code from the {@link AnswerConstraint}.
 */
public final class ErrorCodes {

    public static final String FIELD_REQUIRED = "FIELD_REQUIRED";
    public static final String FIXED_VALUE_MISMATCH = "FIXED_VALUE_MISMATCH";
    public static final String VALUE_NOT_ALLOWED = "VALUE_NOT_ALLOWED";
    public static final String PATTERN_MISMATCH = "PATTERN_MISMATCH";
    public static final String ARRAY_LENGTH_VIOLATION = "ARRAY_LENGTH_VIOLATION";
    public static final String INVALID_CODE = "INVALID_CODE";
    public static final String RESOURCE_REQUIREMENT_VIOLATION = "RESOURCE_REQUIREMENT_VIOLATION";

    public static final String VALUE_OUT_OF_RANGE = "VALUE_OUT_OF_RANGE";
    public static final String FORMAT_INVALID = "FORMAT_INVALID";
    public static final String REFERENCE_INVALID = "REFERENCE_INVALID";
    public static final String CUSTOM_RULE_FAILED = "CUSTOM_RULE_FAILED";

    public static final String ANSWER_REQUIRED = "ANSWER_REQUIRED";
    public static final String INVALID_ANSWER_TYPE = "INVALID_ANSWER_TYPE";
    public static final String ANSWER_OUT_OF_RANGE = "ANSWER_OUT_OF_RANGE";
    public static final String ANSWER_NOT_IN_VALUESET = "ANSWER_NOT_IN_VALUESET";
    public static final String ANSWER_MULTIPLE_NOT_ALLOWED = "ANSWER_MULTIPLE_NOT_ALLOWED";
    public static final String QUESTION_NOT_FOUND = "QUESTION_NOT_FOUND";
    public static final String QUESTIONSET_DATA_MISSING = "QUESTIONSET_DATA_MISSING";

    public static final String REFERENCE_NOT_FOUND = "REFERENCE_NOT_FOUND";
    public static final String REFERENCE_TYPE_MISMATCH = "REFERENCE_TYPE_MISMATCH";
    public static final String CODE_NOT_IN_CODESYSTEM = "CODE_NOT_IN_CODESYSTEM";
    public static final String STRUCTURE_INVALID = "STRUCTURE_INVALID";
    public static final String LINT_EMPTY_VALUE = "LINT_EMPTY_VALUE";
    public static final String SPEC_HINT_REQUIRED_ELEMENT = "SPEC_HINT_REQUIRED_ELEMENT";

    /** Codes an author may choose for a {@link RuleType#CUSTOM_EXPRESSION} rule. */
    public static final Set<String> GOVERNED_CUSTOM_CODES = Set.of(
            VALUE_NOT_ALLOWED,
            PATTERN_MISMATCH,
            FIELD_REQUIRED,
            ARRAY_LENGTH_VIOLATION,
            FIXED_VALUE_MISMATCH,
            INVALID_CODE,
            VALUE_OUT_OF_RANGE,
            FORMAT_INVALID,
            REFERENCE_INVALID,
            CUSTOM_RULE_FAILED);

    private static final Map<RuleType, String> FIXED_CODES = new EnumMap<>(RuleType.class);

    static {
        FIXED_CODES.put(RuleType.REQUIRED, FIELD_REQUIRED);
        FIXED_CODES.put(RuleType.FIXED_VALUE, FIXED_VALUE_MISMATCH);
        FIXED_CODES.put(RuleType.ALLOWED_VALUES, VALUE_NOT_ALLOWED);
        FIXED_CODES.put(RuleType.REGEX, PATTERN_MISMATCH);
        FIXED_CODES.put(RuleType.ARRAY_LENGTH, ARRAY_LENGTH_VIOLATION);
        FIXED_CODES.put(RuleType.CODE_SYSTEM, INVALID_CODE);
        FIXED_CODES.put(RuleType.RESOURCE_COMPOSITION, RESOURCE_REQUIREMENT_VIOLATION);
    }

    private ErrorCodes() {}

    /**
     * The fixed code for the rule type, or empty for types whose code is chosen
     * by the author or derived from params.
     */
    public static Optional<String> fixedCodeFor(RuleType type) {
        return Optional.ofNullable(FIXED_CODES.get(type));
    }
}
