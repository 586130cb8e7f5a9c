package io.fhirrules.core.error;

/**
 * The record handed to the engine is not a resource: it is not a JSON object,
 * or it has no {@code resourceType}.
 */
public final class RecordFormatException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    public RecordFormatException(String message) {
        super(message, null, Phase.EVALUATION);
    }

    public RecordFormatException(String message, Throwable cause) {
        super(message, cause, null, Phase.EVALUATION);
    }
}
