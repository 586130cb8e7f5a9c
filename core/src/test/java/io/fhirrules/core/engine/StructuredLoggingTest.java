package io.fhirrules.core.engine;

import static io.fhirrules.core.testkit.TestRecords.bundleOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.fhirrules.core.config.EngineConfig;
import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.RuleSet;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Every validation emits one INFO summary line carrying the rule set id,
 * counts, verdict and duration, with the rule set and record ids in the MDC
 * while the call runs and removed afterwards.
 */
@DisplayName("StructuredLoggingTest")
class StructuredLoggingTest {

    private static final RuleSet RULES = RuleSet.of("patient-core", List.of(Rule.builder()
            .id("patient-birthdate")
            .resourceType("Patient")
            .fieldPath("birthDate")
            .params(new RuleParams.RequiredParams())
            .build()));

    private ValidationEngine engine;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger engineLogger;

    @BeforeEach
    void setUp() {
        engine = new ValidationEngine(EngineConfig.defaults(), List.of());

        engineLogger = (Logger) LoggerFactory.getLogger(ValidationEngine.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        engineLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    @Test
    @DisplayName("Validation emits one summary entry with counts and verdict")
    void validationEmitsSummary() {
        engine.validate(bundleOf("""
                {"resourceType": "Patient", "id": "p1"}"""), RULES);

        List<ILoggingEvent> summaries = logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.INFO)
                .filter(e -> e.getMessage().startsWith("ruleset="))
                .toList();

        assertThat(summaries).hasSize(1);
        String line = summaries.get(0).getFormattedMessage();
        assertThat(line)
                .contains("ruleset=patient-core")
                .contains("rules=1")
                .contains("findings=1")
                .contains("blocking=1")
                .contains("verdict=NON_COMPLIANT")
                .contains("durationMs=");
    }

    @Test
    @DisplayName("MDC carries rule set and record ids during the call")
    void mdcIsPopulatedDuringCall() {
        engine.validate(bundleOf("""
                {"resourceType": "Patient", "id": "p1", "birthDate": "1980-01-01"}"""), RULES);

        ILoggingEvent summary = logAppender.list.stream()
                .filter(e -> e.getLevel() == Level.INFO)
                .reduce((first, second) -> second)
                .orElseThrow();

        assertThat(summary.getMDCPropertyMap())
                .containsEntry(ValidationEngine.MDC_RULE_SET_ID, "patient-core")
                .containsEntry(ValidationEngine.MDC_RECORD_ID, "test-bundle");
    }

    @Test
    @DisplayName("MDC is cleared after the call, also when it fails")
    void mdcIsClearedAfterwards() {
        engine.validate(bundleOf("""
                {"resourceType": "Patient", "id": "p1"}"""), RULES);

        assertThat(MDC.get(ValidationEngine.MDC_RULE_SET_ID)).isNull();
        assertThat(MDC.get(ValidationEngine.MDC_RECORD_ID)).isNull();

        RuleSet broken = RuleSet.of("broken", List.of(Rule.builder()
                .id("where-rule")
                .resourceType("Patient")
                .fieldPath("identifier.where(system='x').value")
                .params(new RuleParams.RequiredParams())
                .build()));
        assertThatThrownBy(() -> engine.evaluate(bundleOf("""
                        {"resourceType": "Patient", "id": "p1"}"""), broken))
                .isInstanceOf(InvalidPathExpressionException.class);

        assertThat(MDC.get(ValidationEngine.MDC_RULE_SET_ID)).isNull();
    }
}
