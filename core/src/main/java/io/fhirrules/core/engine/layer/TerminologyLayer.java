package io.fhirrules.core.engine.layer;

import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Terminology layer over a fixed catalogue of code systems. Every Coding whose
 * {@code system} is in the catalogue must carry one of its codes. Codings of
 * unknown systems are not judged.
 */
public final class TerminologyLayer implements ValidationLayer {

    private final Map<String, Set<String>> codeSystems;

    /**
     * @param codeSystems code-system URI to the complete set of its codes
     */
    public TerminologyLayer(Map<String, Set<String>> codeSystems) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        codeSystems.forEach((system, codes) -> copy.put(system, Set.copyOf(codes)));
        this.codeSystems = Map.copyOf(copy);
    }

    @Override
    public FindingSource source() {
        return FindingSource.TERMINOLOGY;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        List<Finding> findings = new ArrayList<>();
        for (Location entry : record.entries()) {
            TreeWalker.walk(entry.resource(), entry.path(), (path, node) -> {
                if (!node.isObject() || !node.path("system").isTextual() || !node.path("code").isTextual()) {
                    return;
                }
                String system = node.get("system").asText();
                String code = node.get("code").asText();
                Set<String> known = codeSystems.get(system);
                if (known != null && !known.contains(code)) {
                    findings.add(new Finding(
                            FindingSource.TERMINOLOGY,
                            Severity.ERROR,
                            path + ".code",
                            "Code '" + code + "' is not defined in code system " + system,
                            ErrorCodes.CODE_NOT_IN_CODESYSTEM,
                            null,
                            entry.resourceType(),
                            Map.of("system", system, "code", code)));
                }
            });
        }
        return findings;
    }
}
