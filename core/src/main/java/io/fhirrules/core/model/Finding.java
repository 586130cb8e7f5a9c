package io.fhirrules.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * The result of one layer check or one rule failing at one location.
 *
 * <p>
 * {@link #isBlocking()} is derived from the severity and the source layer and
 * is never stored.
 *
 * @param source       the layer that produced the finding
 * @param severity     reported severity
 * @param path         concrete path of the offending value
 * @param message      human-readable message
 * @param errorCode    machine-readable code
 * @param ruleId       the rule that failed, or {@code null} for layer checks
 * @param resourceType the resource type of the offending instance, or
 *                     {@code null}
 * @param details      structured facts, e.g. {@code count} and {@code min}
 */
public record Finding(
        FindingSource source,
        Severity severity,
        String path,
        String message,
        String errorCode,
        String ruleId,
        String resourceType,
        Map<String, Object> details) {

    public Finding {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(errorCode, "errorCode must not be null");
        path = path == null ? "" : path;
        message = message == null ? "" : message;
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * A finding blocks compliance iff its severity is not
     * {@link Severity#WARNING} and its layer is blocking-capable. Advisory
     * layers never block.
     */
    public boolean isBlocking() {
        return severity != Severity.WARNING && source.blockingCapable();
    }
}
