package io.fhirrules.core.governance;

/**
 * Issue codes emitted by {@link RuleReviewEngine}.
 */
public final class ReviewCodes {

    // Blocking
    public static final String ROOT_LEVEL_PATH = "ROOT_LEVEL_PATH";
    public static final String FIELD_PATH_RESOURCE_PREFIX = "FIELD_PATH_RESOURCE_PREFIX";
    public static final String FIELD_PATH_BUNDLE_REFERENCE = "FIELD_PATH_BUNDLE_REFERENCE";
    public static final String FIELD_PATH_INDEX_MARKER = "FIELD_PATH_INDEX_MARKER";
    public static final String FIELD_PATH_FILTER_CLAUSE = "FIELD_PATH_FILTER_CLAUSE";
    public static final String FIELD_PATH_FUNCTION = "FIELD_PATH_FUNCTION";
    public static final String PATTERN_ON_NON_STRING = "PATTERN_ON_NON_STRING";

    // Warning
    public static final String RULE_SEMANTIC_STABILITY_INFO = "RULE_SEMANTIC_STABILITY_INFO";
    public static final String ARRAY_LENGTH_ON_NON_ARRAY = "ARRAY_LENGTH_ON_NON_ARRAY";
    public static final String BROAD_PATH = "BROAD_PATH";
    public static final String GENERIC_WILDCARD = "GENERIC_WILDCARD";
    public static final String FIXED_VALUE_WITHOUT_SYSTEM = "FIXED_VALUE_WITHOUT_SYSTEM";
    public static final String DUPLICATE_RULE = "DUPLICATE_RULE";
    public static final String PATH_ERROR_CODE_CONFLICT = "PATH_ERROR_CODE_CONFLICT";

    private ReviewCodes() {}
}
