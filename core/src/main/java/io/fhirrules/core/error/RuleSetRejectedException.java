package io.fhirrules.core.error;

import io.fhirrules.core.model.ReviewResult;
import io.fhirrules.core.model.ReviewStatus;
import java.util.List;

/**
 * The governance gate refused to persist a rule set because at least one rule
 * is {@link ReviewStatus#BLOCKED}. Nothing was saved. The complete review,
 * including rules that passed, is available through {@link #results()}.
 */
public final class RuleSetRejectedException extends RuleEngineException {

    private static final long serialVersionUID = 1L;

    private final String ruleSetId;
    private final transient List<ReviewResult> results;

    public RuleSetRejectedException(String ruleSetId, List<ReviewResult> results) {
        super(buildMessage(ruleSetId, results), firstBlocked(results), Phase.AUTHORING);
        this.ruleSetId = ruleSetId;
        this.results = List.copyOf(results);
    }

    /** The id of the rule set that was refused. */
    public String ruleSetId() {
        return ruleSetId;
    }

    /** Every review result of the refused batch, in rule order. */
    public List<ReviewResult> results() {
        return results;
    }

    /** Ids of the rules that blocked the save. */
    public List<String> blockedRuleIds() {
        return results.stream()
                .filter(r -> r.status() == ReviewStatus.BLOCKED)
                .map(ReviewResult::ruleId)
                .toList();
    }

    private static String firstBlocked(List<ReviewResult> results) {
        return results.stream()
                .filter(r -> r.status() == ReviewStatus.BLOCKED)
                .map(ReviewResult::ruleId)
                .findFirst()
                .orElse(null);
    }

    private static String buildMessage(String ruleSetId, List<ReviewResult> results) {
        long blocked = results.stream()
                .filter(r -> r.status() == ReviewStatus.BLOCKED)
                .count();
        return String.format(
                "Rule set '%s' was not saved: %d of %d rule(s) blocked by governance review",
                ruleSetId, blocked, results.size());
    }
}
