package io.fhirrules.core.model;

/**
 * The closed set of business rule types. Every consumer that branches on the
 * type uses an exhaustive {@code switch} without a {@code default} branch, so a
 * new constant fails compilation until every consumer handles it.
 */
public enum RuleType {
    REQUIRED("Required", false),
    FIXED_VALUE("FixedValue", false),
    ALLOWED_VALUES("AllowedValues", false),
    REGEX("Regex", false),
    ARRAY_LENGTH("ArrayLength", false),
    CODE_SYSTEM("CodeSystem", false),
    CUSTOM_EXPRESSION("CustomExpression", false),
    RESOURCE_COMPOSITION("ResourceComposition", true),
    QUESTION_ANSWER("QuestionAnswer", false);

    private final String wireName;
    private final boolean recordScoped;

    RuleType(String wireName, boolean recordScoped) {
        this.wireName = wireName;
        this.recordScoped = recordScoped;
    }

    /** The name used in rule-set files, e.g. {@code ArrayLength}. */
    public String wireName() {
        return wireName;
    }

    /**
     * Whether the rule is evaluated once against the whole record instead of
     * once per resolved location. Record-scoped rules carry no field path.
     */
    public boolean recordScoped() {
        return recordScoped;
    }

    /**
     * Resolves a wire name (exact, case-sensitive match).
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static RuleType fromWireName(String name) {
        for (RuleType t : values()) {
            if (t.wireName.equals(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown rule type '" + name + "'");
    }
}
