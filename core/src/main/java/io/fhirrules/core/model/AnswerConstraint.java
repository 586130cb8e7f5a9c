package io.fhirrules.core.model;

/**
 * Constraint a {@link RuleType#QUESTION_ANSWER} rule checks against the
 * referenced question definition. Each constraint carries its fixed error code.
 */
public enum AnswerConstraint {
    /** An answer must be present. */
    REQUIRED("required", ErrorCodes.ANSWER_REQUIRED),
    /** The answer value must have the question's declared answer type. */
    TYPE("type", ErrorCodes.INVALID_ANSWER_TYPE),
    /** A numeric answer must lie within the question's min/max. */
    RANGE("range", ErrorCodes.ANSWER_OUT_OF_RANGE),
    /** A coded answer must be one of the question's allowed codes. */
    VALUESET("valueset", ErrorCodes.ANSWER_NOT_IN_VALUESET),
    /** At most one answer value unless the question allows several. */
    SINGLE_ANSWER("single-answer", ErrorCodes.ANSWER_MULTIPLE_NOT_ALLOWED);

    private final String wireName;
    private final String errorCode;

    AnswerConstraint(String wireName, String errorCode) {
        this.wireName = wireName;
        this.errorCode = errorCode;
    }

    public String wireName() {
        return wireName;
    }

    public String errorCode() {
        return errorCode;
    }

    /** @throws IllegalArgumentException if the name is unknown */
    public static AnswerConstraint fromWireName(String name) {
        for (AnswerConstraint c : values()) {
            if (c.wireName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown answer constraint '" + name + "'");
    }
}
