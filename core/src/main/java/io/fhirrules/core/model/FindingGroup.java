package io.fhirrules.core.model;

import java.util.List;

/**
 * Findings sharing a grouping key, for display only.
 *
 * @param key       {@code source|code} or {@code source|ruleId|code}
 * @param source    shared source
 * @param errorCode shared code
 * @param ruleId    shared rule id for business groups, otherwise {@code null}
 * @param findings  members in evaluation order, at least two
 */
public record FindingGroup(String key, FindingSource source, String errorCode, String ruleId, List<Finding> findings) {

    public FindingGroup {
        findings = List.copyOf(findings);
    }

    public int size() {
        return findings.size();
    }

    /** Whether the members block; all members share source and, in practice, severity. */
    public boolean isBlocking() {
        return findings.stream().anyMatch(Finding::isBlocking);
    }
}
