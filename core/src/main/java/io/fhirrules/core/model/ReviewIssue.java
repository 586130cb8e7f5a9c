package io.fhirrules.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * One governance finding about a rule.
 *
 * @param code     issue code, e.g. {@code FIELD_PATH_FILTER_CLAUSE}
 * @param severity {@link ReviewStatus#BLOCKED} or {@link ReviewStatus#WARNING}
 * @param ruleId   the reviewed rule
 * @param facts    structured facts explaining the issue
 */
public record ReviewIssue(String code, ReviewStatus severity, String ruleId, Map<String, Object> facts) {

    public ReviewIssue {
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        if (severity == ReviewStatus.OK) {
            throw new IllegalArgumentException("An issue cannot have severity OK");
        }
        facts = facts == null ? Map.of() : Map.copyOf(facts);
    }
}
