package io.fhirrules.core.engine;

import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import java.util.List;
import java.util.Objects;

/**
 * Findings produced by one layer, tagged with the layer's source.
 */
public record LayerOutput(FindingSource source, List<Finding> findings) {

    public LayerOutput {
        Objects.requireNonNull(source, "source must not be null");
        findings = findings == null ? List.of() : List.copyOf(findings);
    }
}
