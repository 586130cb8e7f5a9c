package io.fhirrules.core.governance;

import io.fhirrules.core.error.RuleSetRejectedException;
import io.fhirrules.core.model.ReviewResult;
import io.fhirrules.core.model.ReviewStatus;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.spi.RuleSetStore;
import io.fhirrules.core.spi.TelemetryListener;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists a rule set only if its governance review has no blocked rule.
 *
 * <p>
 * The review re-runs in full on every save; a previous result is never
 * trusted. A refused save persists nothing, whatever the other rules' status.
 */
public final class RuleSetSaveGate {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetSaveGate.class);

    private final RuleSetStore store;
    private final TelemetryListener telemetryListener;

    public RuleSetSaveGate(RuleSetStore store) {
        this(store, null);
    }

    /**
     * @param store             the persistence collaborator
     * @param telemetryListener listener for review events, or {@code null}
     */
    public RuleSetSaveGate(RuleSetStore store, TelemetryListener telemetryListener) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.telemetryListener = telemetryListener;
    }

    /**
     * Reviews and, if nothing is blocked, persists the rule set.
     *
     * @param ruleSet the candidate rule set
     * @return the review results of the saved set (OK or WARNING only)
     * @throws RuleSetRejectedException if any rule is blocked; carries every
     *                                  result
     */
    public List<ReviewResult> save(RuleSet ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        List<ReviewResult> results = RuleReviewEngine.review(ruleSet.rules());
        notifyReviewCompleted(ruleSet, results);

        if (RuleReviewEngine.anyBlocked(results)) {
            RuleSetRejectedException rejected = new RuleSetRejectedException(ruleSet.id(), results);
            LOG.warn("Refused to save rule set {}: blocked rules {}", ruleSet.id(), rejected.blockedRuleIds());
            notifySaveRefused(ruleSet.id(), rejected.blockedRuleIds());
            throw rejected;
        }

        store.replace(ruleSet);
        LOG.info("Saved rule set {} with {} rule(s)", ruleSet.id(), ruleSet.rules().size());
        return results;
    }

    // --- Telemetry notification helpers ---

    private void notifyReviewCompleted(RuleSet ruleSet, List<ReviewResult> results) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onReviewCompleted(new TelemetryListener.ReviewCompletedEvent(
                    ruleSet.id(),
                    results.size(),
                    count(results, ReviewStatus.BLOCKED),
                    count(results, ReviewStatus.WARNING)));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onReviewCompleted failed", e);
        }
    }

    private void notifySaveRefused(String ruleSetId, List<String> blockedRuleIds) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onSaveRefused(new TelemetryListener.SaveRefusedEvent(ruleSetId, blockedRuleIds));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onSaveRefused failed", e);
        }
    }

    private static int count(List<ReviewResult> results, ReviewStatus status) {
        return (int) results.stream().filter(r -> r.status() == status).count();
    }
}
