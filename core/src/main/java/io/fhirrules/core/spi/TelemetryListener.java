package io.fhirrules.core.spi;

import io.fhirrules.core.model.FindingSource;
import java.util.List;

/**
 * SPI for observability hooks.
 *
 * <p>
 * Hosts provide implementations that bridge to their metrics or tracing
 * system. The core has no telemetry dependency; this is a plain Java
 * interface.
 *
 * <p>
 * All methods receive immutable event objects. Implementations MUST be
 * thread-safe and non-blocking. Exceptions thrown by listeners are caught and
 * logged by the caller. They never change a verdict or a review.
 */
public interface TelemetryListener {

    /**
     * Called after a record has been validated.
     *
     * @param event contains ruleSetId, recordId, counts and durationMs
     */
    void onEvaluationCompleted(EvaluationCompletedEvent event);

    /**
     * Called after one validation layer has run.
     *
     * @param event contains the layer, its finding count and durationMs
     */
    void onLayerCompleted(LayerCompletedEvent event);

    /**
     * Called after a governance review.
     *
     * @param event contains ruleSetId and status counts
     */
    void onReviewCompleted(ReviewCompletedEvent event);

    /**
     * Called when the save gate refuses a rule set.
     *
     * @param event contains ruleSetId and the blocked rule ids
     */
    void onSaveRefused(SaveRefusedEvent event);

    // --- Event records ---

    /** Event emitted when a record validation completes. */
    record EvaluationCompletedEvent(
            String ruleSetId, String recordId, int ruleCount, int findingCount, int blockingCount, long durationMs) {}

    /** Event emitted when one layer completes. */
    record LayerCompletedEvent(FindingSource layer, int findingCount, long durationMs) {}

    /** Event emitted when a governance review completes. */
    record ReviewCompletedEvent(String ruleSetId, int ruleCount, int blockedCount, int warningCount) {}

    /** Event emitted when a save is refused. */
    record SaveRefusedEvent(String ruleSetId, List<String> blockedRuleIds) {}
}
