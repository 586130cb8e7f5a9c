package io.fhirrules.core.engine.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Advisory JSON-level lint: FHIR JSON must not contain empty strings, empty
 * arrays or empty objects. Findings are reported as errors since FHIR treats
 * these as invalid; the layer is advisory and never blocks.
 */
public final class LintLayer implements ValidationLayer {

    @Override
    public FindingSource source() {
        return FindingSource.LINT;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        List<Finding> findings = new ArrayList<>();
        for (Location entry : record.entries()) {
            TreeWalker.walk(entry.resource(), entry.path(), (path, node) -> {
                String kind = emptyKind(node);
                if (kind != null) {
                    findings.add(new Finding(
                            FindingSource.LINT,
                            Severity.ERROR,
                            path,
                            "Empty " + kind + " is not allowed in FHIR JSON",
                            ErrorCodes.LINT_EMPTY_VALUE,
                            null,
                            entry.resourceType(),
                            Map.of("kind", kind)));
                }
            });
        }
        return findings;
    }

    private static String emptyKind(JsonNode node) {
        if (node.isTextual() && node.asText().isEmpty()) {
            return "string";
        }
        if (node.isArray() && node.isEmpty()) {
            return "array";
        }
        if (node.isObject() && node.isEmpty()) {
            return "object";
        }
        return null;
    }
}
