package io.fhirrules.core.model;

import java.util.List;

/**
 * Aggregated result of validating one record.
 *
 * @param findings        all findings in layer order, then evaluation order
 * @param mustFix         number of blocking findings
 * @param recommendations number of non-blocking findings
 * @param verdict         overall verdict
 * @param view            grouped display view of {@code findings}
 */
public record ValidationReport(
        List<Finding> findings, int mustFix, int recommendations, Verdict verdict, PresentationView view) {

    public ValidationReport {
        findings = List.copyOf(findings);
    }

    public boolean isCompliant() {
        return verdict.isCompliant();
    }

    /** Findings from one layer. */
    public List<Finding> findingsFrom(FindingSource source) {
        return findings.stream().filter(f -> f.source() == source).toList();
    }
}
