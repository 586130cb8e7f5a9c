package io.fhirrules.core.error;

/**
 * A path expression does not parse under the constrained path grammar, or it
 * parses but cannot be navigated against a record (for example a scope filter
 * that reaches outside the resource).
 */
public final class InvalidPathExpressionException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    private final String expression;

    public InvalidPathExpressionException(String message, String expression) {
        this(message, expression, null, Phase.AUTHORING);
    }

    public InvalidPathExpressionException(String message, String expression, String ruleId, Phase phase) {
        super(message, ruleId, phase);
        this.expression = expression;
    }

    /** The offending expression text. */
    public String expression() {
        return expression;
    }
}
