package io.fhirrules.core.engine;

import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.Severity;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory methods for business-layer findings. The rule's hint, when present,
 * replaces the generated message, which then moves to {@code details.reason}.
 */
final class Findings {

    private Findings() {}

    static Finding business(Rule rule, Location loc, String path, String message, Map<String, Object> details) {
        return business(rule, rule.severity(), rule.errorCode(), loc == null ? null : loc.resourceType(), path, message, details);
    }

    static Finding business(
            Rule rule,
            Severity severity,
            String errorCode,
            String resourceType,
            String path,
            String message,
            Map<String, Object> details) {
        Map<String, Object> merged = details;
        String text = message;
        if (rule.hint() != null && !rule.hint().isBlank()) {
            merged = new LinkedHashMap<>(details);
            merged.put("reason", message);
            text = rule.hint();
        }
        return new Finding(FindingSource.BUSINESS, severity, path, text, errorCode, rule.id(), resourceType, merged);
    }
}
