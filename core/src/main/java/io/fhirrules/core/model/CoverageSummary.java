package io.fhirrules.core.model;

import java.util.List;

/**
 * Derived coverage statistics. {@code covered + suggested + uncovered ==
 * total} always holds. Match-type counts refer to covered nodes only.
 */
public record CoverageSummary(
        int total,
        int covered,
        int suggested,
        int uncovered,
        int exactMatches,
        int wildcardMatches,
        int parentMatches,
        int percentage) {

    /** Computes the summary of a node list. */
    public static CoverageSummary of(List<CoverageNode> nodes) {
        int covered = 0;
        int suggested = 0;
        int uncovered = 0;
        int exact = 0;
        int wildcard = 0;
        int parent = 0;
        for (CoverageNode node : nodes) {
            switch (node.status()) {
                case COVERED -> {
                    covered++;
                    switch (node.matchType()) {
                        case EXACT -> exact++;
                        case WILDCARD -> wildcard++;
                        case PARENT -> parent++;
                    }
                }
                case SUGGESTED -> suggested++;
                case UNCOVERED -> uncovered++;
            }
        }
        int total = nodes.size();
        int percentage = total == 0 ? 0 : (int) Math.round(covered * 100.0 / total);
        return new CoverageSummary(total, covered, suggested, uncovered, exact, wildcard, parent, percentage);
    }
}
