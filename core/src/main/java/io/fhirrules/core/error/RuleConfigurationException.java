package io.fhirrules.core.error;

/**
 * A rule definition is invalid for its declared type: required params are
 * missing, a bound is out of range, a pattern does not compile, or the error
 * code is outside the vocabulary governed for the rule type.
 *
 * <p>
 * Raised synchronously when the rule is constructed. Never coerced.
 */
public final class RuleConfigurationException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    public RuleConfigurationException(String message, String ruleId) {
        super(message, ruleId, Phase.AUTHORING);
    }

    public RuleConfigurationException(String message, Throwable cause, String ruleId) {
        super(message, cause, ruleId, Phase.AUTHORING);
    }
}
