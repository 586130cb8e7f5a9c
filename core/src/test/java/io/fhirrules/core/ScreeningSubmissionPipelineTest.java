package io.fhirrules.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fhirrules.core.config.EngineConfig;
import io.fhirrules.core.engine.ValidationEngine;
import io.fhirrules.core.engine.layer.LintLayer;
import io.fhirrules.core.engine.layer.ReferenceIntegrityLayer;
import io.fhirrules.core.engine.layer.TerminologyLayer;
import io.fhirrules.core.governance.RuleReviewEngine;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.ReviewStatus;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.model.ValidationReport;
import io.fhirrules.core.model.Verdict;
import io.fhirrules.core.ruleset.QuestionSetParser;
import io.fhirrules.core.ruleset.RuleSetParser;
import io.fhirrules.core.testkit.TestRecords;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Loads the screening rule set and question set from YAML and validates the
 * sample submission bundle through every layer.
 */
@DisplayName("Screening submission pipeline")
class ScreeningSubmissionPipelineTest {

    private RuleSet ruleSet;
    private Map<String, QuestionSet> questionSets;
    private ValidationEngine engine;

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(ScreeningSubmissionPipelineTest.class.getClassLoader().getResource(name).toURI());
    }

    @BeforeEach
    void setUp() throws URISyntaxException {
        ruleSet = RuleSetParser.parse(resource("rulesets/patient-core.yaml"));
        QuestionSet hearing = QuestionSetParser.parse(resource("questionsets/hearing.yaml"));
        questionSets = Map.of(hearing.id(), hearing);
        engine = new ValidationEngine(EngineConfig.defaults(), List.of(
                new TerminologyLayer(Map.of("https://example.org/answers", Set.of("Y", "N"))),
                new ReferenceIntegrityLayer(EngineConfig.defaults().referencePolicy()),
                new LintLayer()));
    }

    @Test
    void sampleRuleSetPassesGovernanceWithNotices() {
        var results = RuleReviewEngine.review(ruleSet.rules());

        assertThat(RuleReviewEngine.anyBlocked(results)).isFalse();
        assertThat(results)
                .filteredOn(r -> r.ruleId().equals("hearing-answers"))
                .singleElement()
                .satisfies(r -> assertThat(r.status()).isEqualTo(ReviewStatus.WARNING));
    }

    @Test
    void sampleSubmissionIsCompliant() {
        ValidationReport report =
                engine.validate(TestRecords.fromClasspath("records/patient-bundle.json"), ruleSet, questionSets);

        assertThat(report.findings()).isEmpty();
        assertThat(report.verdict()).isEqualTo(Verdict.COMPLIANT);
    }

    @Test
    void brokenSubmissionCollectsFindingsFromEveryLayer() {
        FhirRecord sample = TestRecords.fromClasspath("records/patient-bundle.json");
        ObjectNode root = sample.root().deepCopy();
        ObjectNode patient = (ObjectNode) root.path("entry").get(0).path("resource");
        patient.remove("birthDate");
        patient.put("gender", "unspecified");
        patient.putArray("telecom");
        ObjectNode hearing = (ObjectNode) root.path("entry").get(1).path("resource");
        ArrayNode answerCoding = (ArrayNode) hearing.path("component").get(0).path("valueCodeableConcept").path("coding");
        ((ObjectNode) answerCoding.get(0)).put("code", "MAYBE");
        ((ObjectNode) root.path("entry").get(2).path("resource").path("subject")).put("reference", "Patient/p9");

        ValidationReport report = engine.validate(FhirRecord.of(root), ruleSet, questionSets);

        assertThat(report.findings())
                .extracting(Finding::source, Finding::errorCode)
                .contains(
                        tuple(FindingSource.BUSINESS, ErrorCodes.FIELD_REQUIRED),
                        tuple(FindingSource.BUSINESS, ErrorCodes.VALUE_NOT_ALLOWED),
                        tuple(
                                FindingSource.TERMINOLOGY, ErrorCodes.CODE_NOT_IN_CODESYSTEM),
                        tuple(FindingSource.REFERENCE, ErrorCodes.REFERENCE_NOT_FOUND),
                        tuple(FindingSource.LINT, ErrorCodes.LINT_EMPTY_VALUE));
        assertThat(report.verdict()).isEqualTo(Verdict.NON_COMPLIANT);
        assertThat(report.findingsFrom(FindingSource.LINT)).allSatisfy(f -> assertThat(f.isBlocking()).isFalse());
    }
}
