package io.fhirrules.core.engine;

import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingGroup;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.PresentationView;
import io.fhirrules.core.model.ValidationReport;
import io.fhirrules.core.model.Verdict;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges the outputs of independent validation layers into one
 * {@link ValidationReport}.
 *
 * <p>
 * A finding blocks iff its severity is not {@code warning} and its layer is
 * blocking-capable ({@link Finding#isBlocking()}). The record is compliant iff
 * no finding blocks. Grouping for display uses {@code source|code}, or
 * {@code source|ruleId|code} for business findings, and keeps only groups of
 * two or more. Counts and the verdict are computed from the flat list, never
 * from groups.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class LayeredValidationAggregator {

    private LayeredValidationAggregator() {}

    /**
     * Aggregates layer outputs.
     *
     * @param outputs layer outputs in layer order
     * @return the report
     * @throws IllegalStateException if a layer returned a finding tagged with
     *                               another layer's source
     */
    public static ValidationReport aggregate(List<LayerOutput> outputs) {
        List<Finding> findings = new ArrayList<>();
        for (LayerOutput output : outputs) {
            for (Finding f : output.findings()) {
                if (f.source() != output.source()) {
                    throw new IllegalStateException(String.format(
                            "Layer %s returned a finding tagged %s (code %s)",
                            output.source().wireName(), f.source().wireName(), f.errorCode()));
                }
                findings.add(f);
            }
        }
        int mustFix = (int) findings.stream().filter(Finding::isBlocking).count();
        int recommendations = findings.size() - mustFix;
        return new ValidationReport(findings, mustFix, recommendations, verdictOf(mustFix, recommendations), group(findings));
    }

    /** Derives the verdict from the counts. */
    public static Verdict verdictOf(int mustFix, int recommendations) {
        if (mustFix > 0) {
            return Verdict.NON_COMPLIANT;
        }
        return recommendations > 0 ? Verdict.COMPLIANT_WITH_RECOMMENDATIONS : Verdict.COMPLIANT;
    }

    /**
     * Groups findings for display. Groups keep first-occurrence order; single
     * findings stay ungrouped in evaluation order.
     */
    public static PresentationView group(List<Finding> findings) {
        Map<String, List<Finding>> byKey = new LinkedHashMap<>();
        for (Finding f : findings) {
            byKey.computeIfAbsent(groupKey(f), k -> new ArrayList<>()).add(f);
        }
        List<FindingGroup> groups = new ArrayList<>();
        for (Map.Entry<String, List<Finding>> e : byKey.entrySet()) {
            if (e.getValue().size() >= 2) {
                Finding first = e.getValue().get(0);
                String ruleId = first.source() == FindingSource.BUSINESS ? first.ruleId() : null;
                groups.add(new FindingGroup(e.getKey(), first.source(), first.errorCode(), ruleId, e.getValue()));
            }
        }
        List<Finding> ungrouped = findings.stream()
                .filter(f -> byKey.get(groupKey(f)).size() < 2)
                .toList();
        return new PresentationView(groups, ungrouped);
    }

    static String groupKey(Finding f) {
        if (f.source() == FindingSource.BUSINESS) {
            return f.source().wireName() + "|" + f.ruleId() + "|" + f.errorCode();
        }
        return f.source().wireName() + "|" + f.errorCode();
    }
}
