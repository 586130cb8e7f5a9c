package io.fhirrules.core.engine;

import io.fhirrules.core.config.EngineConfig;
import io.fhirrules.core.engine.layer.JsonSchemaStructuralLayer;
import io.fhirrules.core.engine.layer.LintLayer;
import io.fhirrules.core.engine.layer.ReferenceIntegrityLayer;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.model.ValidationReport;
import io.fhirrules.core.spi.TelemetryListener;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Validate-time entry point. Runs the business rules of a rule set together
 * with the registered external layers and aggregates the result.
 *
 * <p>
 * Layers run in the fixed order structural, business, terminology, reference,
 * lint, spec-hint; layers disabled in {@link EngineConfig} are skipped. Each
 * call is independent. The engine holds only immutable configuration and is
 * safe to share between threads.
 *
 * <p>
 * During a call the MDC carries {@code ruleSetId} and {@code recordId}.
 */
public final class ValidationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationEngine.class);

    /** MDC key for the rule set being evaluated. */
    static final String MDC_RULE_SET_ID = "ruleSetId";
    /** MDC key for the id of the record being evaluated. */
    static final String MDC_RECORD_ID = "recordId";

    private final EngineConfig config;
    private final List<ValidationLayer> layers;
    private final TelemetryListener telemetryListener;

    /**
     * Creates an engine with the given external layers and no telemetry.
     *
     * @param config engine configuration
     * @param layers external layers; the business layer is added per call
     */
    public ValidationEngine(EngineConfig config, List<ValidationLayer> layers) {
        this(config, layers, null);
    }

    /**
     * Creates an engine with the given external layers and an optional
     * telemetry listener.
     *
     * @param config            engine configuration
     * @param layers            external layers; none may have the business
     *                          source
     * @param telemetryListener listener for lifecycle events, or {@code null}
     */
    public ValidationEngine(EngineConfig config, List<ValidationLayer> layers, TelemetryListener telemetryListener) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        for (ValidationLayer layer : layers) {
            if (layer.source() == FindingSource.BUSINESS) {
                throw new IllegalArgumentException("The business layer is built from the rule set; do not register one");
            }
        }
        this.layers = List.copyOf(layers);
        this.telemetryListener = config.telemetryEnabled() ? telemetryListener : null;
    }

    /**
     * Creates an engine with the layers the configuration alone can build: the
     * structural layer when a schema is configured, the reference layer and the
     * lint layer.
     */
    public static ValidationEngine fromConfig(EngineConfig config, TelemetryListener telemetryListener) {
        List<ValidationLayer> layers = new ArrayList<>();
        if (config.structuralSchema() != null) {
            layers.add(JsonSchemaStructuralLayer.fromFile(config.structuralSchema()));
        }
        layers.add(new ReferenceIntegrityLayer(config.referencePolicy()));
        layers.add(new LintLayer());
        return new ValidationEngine(config, layers, telemetryListener);
    }

    /** Business findings only. */
    public List<Finding> evaluate(FhirRecord record, RuleSet ruleSet) {
        return evaluate(record, ruleSet, Map.of());
    }

    /**
     * Evaluates the rule set alone.
     *
     * @return business findings in rule-set order, then document order
     */
    public List<Finding> evaluate(FhirRecord record, RuleSet ruleSet, Map<String, QuestionSet> questionSets) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        setContext(record, ruleSet);
        try {
            return new BusinessRuleLayer(ruleSet, questionSets).validate(record);
        } finally {
            clearContext();
        }
    }

    /** Validates with no question sets. */
    public ValidationReport validate(FhirRecord record, RuleSet ruleSet) {
        return validate(record, ruleSet, Map.of());
    }

    /**
     * Runs every enabled layer and aggregates the verdict.
     *
     * @param record       the record
     * @param ruleSet      the business rules
     * @param questionSets question sets by id for question-answer rules
     * @return the aggregated report
     */
    public ValidationReport validate(FhirRecord record, RuleSet ruleSet, Map<String, QuestionSet> questionSets) {
        Objects.requireNonNull(record, "record must not be null");
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        setContext(record, ruleSet);
        try {
            long start = System.nanoTime();
            List<ValidationLayer> ordered = new ArrayList<>(layers);
            ordered.add(new BusinessRuleLayer(ruleSet, questionSets));
            ordered.sort(Comparator.comparing(ValidationLayer::source));

            List<LayerOutput> outputs = new ArrayList<>();
            for (ValidationLayer layer : ordered) {
                if (!config.isEnabled(layer.source())) {
                    LOG.debug("Layer {} disabled; skipped", layer.source().wireName());
                    continue;
                }
                long layerStart = System.nanoTime();
                List<Finding> findings = layer.validate(record);
                long layerMs = (System.nanoTime() - layerStart) / 1_000_000;
                LOG.debug("layer={} findings={} durationMs={}", layer.source().wireName(), findings.size(), layerMs);
                notifyLayerCompleted(layer.source(), findings.size(), layerMs);
                outputs.add(new LayerOutput(layer.source(), findings));
            }

            ValidationReport report = LayeredValidationAggregator.aggregate(outputs);
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            LOG.info(
                    "ruleset={} rules={} findings={} blocking={} verdict={} durationMs={}",
                    ruleSet.id(),
                    ruleSet.rules().size(),
                    report.findings().size(),
                    report.mustFix(),
                    report.verdict(),
                    durationMs);
            notifyEvaluationCompleted(record, ruleSet, report, durationMs);
            return report;
        } finally {
            clearContext();
        }
    }

    public EngineConfig config() {
        return config;
    }

    // --- Telemetry notification helpers ---

    private void notifyLayerCompleted(FindingSource source, int findingCount, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onLayerCompleted(
                    new TelemetryListener.LayerCompletedEvent(source, findingCount, durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onLayerCompleted failed", e);
        }
    }

    private void notifyEvaluationCompleted(
            FhirRecord record, RuleSet ruleSet, ValidationReport report, long durationMs) {
        if (telemetryListener == null) return;
        try {
            telemetryListener.onEvaluationCompleted(new TelemetryListener.EvaluationCompletedEvent(
                    ruleSet.id(),
                    record.id(),
                    ruleSet.rules().size(),
                    report.findings().size(),
                    report.mustFix(),
                    durationMs));
        } catch (Exception e) {
            LOG.warn("TelemetryListener.onEvaluationCompleted failed", e);
        }
    }

    // --- MDC context ---

    private static void setContext(FhirRecord record, RuleSet ruleSet) {
        MDC.put(MDC_RULE_SET_ID, ruleSet.id());
        if (record.id() != null) {
            MDC.put(MDC_RECORD_ID, record.id());
        }
    }

    private static void clearContext() {
        MDC.remove(MDC_RULE_SET_ID);
        MDC.remove(MDC_RECORD_ID);
    }
}
