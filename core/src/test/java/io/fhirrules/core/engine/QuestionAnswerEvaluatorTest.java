package io.fhirrules.core.engine;

import static io.fhirrules.core.testkit.TestRecords.bundleOf;
import static io.fhirrules.core.testkit.TestRecords.json;
import static org.assertj.core.api.Assertions.assertThat;

import io.fhirrules.core.model.AnswerConstraint;
import io.fhirrules.core.model.AnswerType;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.Question;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.path.PathExpression;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("QuestionAnswer rules")
class QuestionAnswerEvaluatorTest {

    private static final String QUESTIONS = "https://example.org/questions";
    private static final String ANSWERS = "https://example.org/answers";

    private static final QuestionSet HEARING = new QuestionSet(
            "hearing",
            List.of(
                    new Question("sq-01", QUESTIONS, "SQ-01", "Passed left ear", AnswerType.CODE, null, null,
                            List.of("Y", "N"), ANSWERS, false),
                    new Question("sq-02", QUESTIONS, "SQ-02", "Threshold", AnswerType.QUANTITY,
                            BigDecimal.ZERO, new BigDecimal("120"), List.of(), null, false)));

    private static final Map<String, QuestionSet> QUESTION_SETS = Map.of("hearing", HEARING);

    private static Rule rule(AnswerConstraint constraint, String answerPath) {
        return Rule.builder()
                .id("qa-" + constraint.wireName())
                .resourceType("Observation")
                .fieldPath("component")
                .params(new RuleParams.QuestionAnswerParams(
                        "hearing",
                        PathExpression.parse("component"),
                        PathExpression.parse("code.coding"),
                        PathExpression.parse(answerPath),
                        constraint))
                .build();
    }

    private static FhirRecord observation(String components) {
        return bundleOf("{\"resourceType\": \"Observation\", \"status\": \"final\", \"component\": [" + components + "]}");
    }

    private static String component(String code, String valueJson) {
        String value = valueJson == null ? "" : ", " + valueJson;
        return "{\"code\": {\"coding\": [{\"system\": \"" + QUESTIONS + "\", \"code\": \"" + code + "\"}]}" + value
                + "}";
    }

    private static final String ANSWER_Y =
            "\"valueCodeableConcept\": {\"coding\": [{\"system\": \"" + ANSWERS + "\", \"code\": \"Y\"}]}";

    @Test
    void requiredAnswerMissing() {
        FhirRecord record = observation(component("SQ-01", null) + "," + component("SQ-02", "\"valueQuantity\": {\"value\": 40}"));

        List<Finding> findings = RuleEvaluator.evaluate(rule(AnswerConstraint.REQUIRED, "value"), record, QUESTION_SETS);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.errorCode()).isEqualTo(ErrorCodes.ANSWER_REQUIRED);
            assertThat(f.path()).isEqualTo("Bundle.entry[0].resource.component[0].value");
            assertThat(f.details()).containsEntry("questionId", "sq-01").containsEntry("constraint", "required");
        });
    }

    @Test
    void rangeChecksQuantityValue() {
        FhirRecord record = observation(component("SQ-02", "\"valueQuantity\": {\"value\": 130, \"unit\": \"dB\"}"));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.RANGE, "value"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.ANSWER_OUT_OF_RANGE);
                    assertThat(f.path()).isEqualTo("Bundle.entry[0].resource.component[0].valueQuantity");
                });
    }

    @Test
    void rangeWithinBoundsPasses() {
        FhirRecord record = observation(component("SQ-02", "\"valueQuantity\": {\"value\": 120}"));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.RANGE, "value"), record, QUESTION_SETS)).isEmpty();
    }

    @Test
    void typeMismatchIsReported() {
        FhirRecord record = observation(component("SQ-01", ANSWER_Y) + "," + component("SQ-02", "\"valueString\": \"72\""));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.TYPE, "value"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.INVALID_ANSWER_TYPE);
                    assertThat(f.path()).isEqualTo("Bundle.entry[0].resource.component[1].valueString");
                });
    }

    @Test
    void valueSetRejectsUnknownAnswerCode() {
        String answerX = "\"valueCodeableConcept\": {\"coding\": [{\"system\": \"" + ANSWERS + "\", \"code\": \"X\"}]}";
        FhirRecord record = observation(component("SQ-01", answerX));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.VALUESET, "value"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.ANSWER_NOT_IN_VALUESET);
                    assertThat(f.path())
                            .isEqualTo("Bundle.entry[0].resource.component[0].valueCodeableConcept.coding[0]");
                });
    }

    @Test
    void valueSetRejectsAnswerCodingWithoutCode() {
        String noCode = "\"valueCodeableConcept\": {\"coding\": [{\"system\": \"" + ANSWERS + "\", \"display\": \"yes\"}]}";
        FhirRecord record = observation(component("SQ-01", noCode));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.VALUESET, "value"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.ANSWER_NOT_IN_VALUESET);
                    assertThat(f.details()).containsEntry("actualCode", "");
                });
    }

    @Test
    void valueSetAcceptsAllowedAnswerCode() {
        assertThat(RuleEvaluator.evaluate(
                        rule(AnswerConstraint.VALUESET, "value"), observation(component("SQ-01", ANSWER_Y)), QUESTION_SETS))
                .isEmpty();
    }

    @Test
    void singleAnswerRejectsSeveralValues() {
        String twoCodings = "\"valueCodeableConcept\": {\"coding\": [{\"system\": \"" + ANSWERS
                + "\", \"code\": \"Y\"}, {\"system\": \"" + ANSWERS + "\", \"code\": \"N\"}]}";
        FhirRecord record = observation(component("SQ-01", twoCodings));

        assertThat(RuleEvaluator.evaluate(
                        rule(AnswerConstraint.SINGLE_ANSWER, "valueCodeableConcept.coding"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> assertThat(f.errorCode()).isEqualTo(ErrorCodes.ANSWER_MULTIPLE_NOT_ALLOWED));
    }

    @Test
    void unknownQuestionIsAWarning() {
        FhirRecord record = observation(component("SQ-99", ANSWER_Y));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.REQUIRED, "value"), record, QUESTION_SETS))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.QUESTION_NOT_FOUND);
                    assertThat(f.severity()).isEqualTo(Severity.WARNING);
                    assertThat(f.isBlocking()).isFalse();
                });
    }

    @Test
    void missingQuestionSetYieldsOneFinding() {
        FhirRecord record = observation(component("SQ-01", ANSWER_Y));

        assertThat(RuleEvaluator.evaluate(rule(AnswerConstraint.REQUIRED, "value"), record, Map.of()))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.QUESTIONSET_DATA_MISSING);
                    assertThat(f.details()).containsEntry("questionSetId", "hearing");
                });
    }

    @Test
    void missingQuestionSetIsSilentWithoutInstances() {
        assertThat(RuleEvaluator.evaluate(
                        rule(AnswerConstraint.REQUIRED, "value"),
                        bundleOf("{\"resourceType\": \"Patient\"}"),
                        Map.of()))
                .isEmpty();
    }

    @Test
    void hasTypeRecognisesAnswerShapes() {
        assertThat(QuestionAnswerEvaluator.hasType(json("{\"value\": 3}"),
                        AnswerType.QUANTITY))
                .isTrue();
        assertThat(QuestionAnswerEvaluator.hasType(json("3"), AnswerType.INTEGER))
                .isTrue();
        assertThat(QuestionAnswerEvaluator.hasType(json("3.5"), AnswerType.INTEGER))
                .isFalse();
    }
}
