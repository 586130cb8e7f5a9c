package io.fhirrules.core.model;

import java.util.List;

/**
 * Coverage of one schema tree: one node per flattened path, in schema order.
 *
 * @param resourceType the schema's resource type
 * @param nodes        per-path coverage
 * @param summary      derived statistics
 */
public record CoverageReport(String resourceType, List<CoverageNode> nodes, CoverageSummary summary) {

    public CoverageReport {
        nodes = List.copyOf(nodes);
    }

    public static CoverageReport of(String resourceType, List<CoverageNode> nodes) {
        return new CoverageReport(resourceType, nodes, CoverageSummary.of(nodes));
    }

    /** The nodes with the given status. */
    public List<CoverageNode> withStatus(CoverageStatus status) {
        return nodes.stream().filter(n -> n.status() == status).toList();
    }
}
