package io.fhirrules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Governance classification of one rule. Computed fresh on every review.
 *
 * @param ruleId the reviewed rule
 * @param status BLOCKED if any issue blocks, else WARNING if any issue exists,
 *               else OK
 * @param issues issues in check order
 */
public record ReviewResult(String ruleId, ReviewStatus status, List<ReviewIssue> issues) {

    public ReviewResult {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        issues = issues == null ? List.of() : List.copyOf(issues);
        Objects.requireNonNull(status, "status must not be null");
    }

    /** Builds a result whose status is derived from the issues. */
    public static ReviewResult of(String ruleId, List<ReviewIssue> issues) {
        return new ReviewResult(ruleId, statusOf(issues), issues);
    }

    /** Derives the status for a list of issues. */
    public static ReviewStatus statusOf(List<ReviewIssue> issues) {
        if (issues.stream().anyMatch(i -> i.severity() == ReviewStatus.BLOCKED)) {
            return ReviewStatus.BLOCKED;
        }
        return issues.isEmpty() ? ReviewStatus.OK : ReviewStatus.WARNING;
    }

    /** Whether an issue with the given code is present. */
    public boolean hasIssue(String code) {
        return issues.stream().anyMatch(i -> i.code().equals(code));
    }
}
