package io.fhirrules.core.error;

/**
 * Rule-set or question-set YAML is malformed, has unknown keys, misses a
 * required key, or describes a rule that fails construction.
 */
public final class RuleSetParseException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    private final String source;

    public RuleSetParseException(String message, String ruleId, String source) {
        super(message, ruleId, Phase.LOAD);
        this.source = source;
    }

    public RuleSetParseException(String message, Throwable cause, String ruleId, String source) {
        super(message, cause, ruleId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or description of the source that failed to parse, or {@code null}. */
    public String source() {
        return source;
    }
}
