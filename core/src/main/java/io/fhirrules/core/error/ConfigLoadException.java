package io.fhirrules.core.error;

/**
 * Thrown when engine configuration loading fails: missing file, invalid YAML,
 * unknown keys or invalid values. Provides a descriptive message suitable for
 * startup error output.
 */
public final class ConfigLoadException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message, null, Phase.LOAD);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause, null, Phase.LOAD);
    }
}
