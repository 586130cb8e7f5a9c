package io.fhirrules.core.error;

/**
 * Abstract base for all fhir-rules exceptions. Never thrown directly. Use one of
 * the concrete subclasses.
 *
 * <p>
 * Evaluation findings and governance blocks are data, not exceptions. Only
 * input the engine cannot interpret (malformed rules, paths, rule-set files or
 * configuration) surfaces as a {@code RuleEngineException}.
 */
public abstract class RuleEngineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        AUTHORING,
        LOAD,
        EVALUATION
    }

    private final String ruleId;
    private final Phase phase;

    protected RuleEngineException(String message, String ruleId, Phase phase) {
        super(message);
        this.ruleId = ruleId;
        this.phase = phase;
    }

    protected RuleEngineException(String message, Throwable cause, String ruleId, Phase phase) {
        super(message, cause);
        this.ruleId = ruleId;
        this.phase = phase;
    }

    /** The rule that triggered the error, or {@code null} if not yet identified. */
    public String ruleId() {
        return ruleId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
