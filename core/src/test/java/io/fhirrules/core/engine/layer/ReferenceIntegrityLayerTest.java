package io.fhirrules.core.engine.layer;

import static io.fhirrules.core.testkit.TestRecords.bundleOf;
import static org.assertj.core.api.Assertions.assertThat;

import io.fhirrules.core.config.ReferencePolicy;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.testkit.TestRecords;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ReferenceIntegrityLayer")
class ReferenceIntegrityLayerTest {

    private static final String PATIENT = """
            {"resourceType": "Patient", "id": "p1"}""";

    private static String observationReferring(String reference) {
        return """
                {"resourceType": "Observation", "id": "o1", "subject": {"reference": "%s"}}""".formatted(reference);
    }

    @Test
    void fixtureBundleResolvesByFullUrlAndTypedId() {
        FhirRecord record = TestRecords.fromClasspath("records/patient-bundle.json");

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.IN_BUNDLE_ONLY).validate(record)).isEmpty();
    }

    @Test
    void unresolvedReferenceIsErrorWhenBundleMustBeClosed() {
        FhirRecord record = bundleOf(PATIENT, observationReferring("Patient/unknown"));

        List<Finding> findings = new ReferenceIntegrityLayer(ReferencePolicy.IN_BUNDLE_ONLY).validate(record);

        assertThat(findings).singleElement().satisfies(f -> {
            assertThat(f.source()).isEqualTo(FindingSource.REFERENCE);
            assertThat(f.errorCode()).isEqualTo(ErrorCodes.REFERENCE_NOT_FOUND);
            assertThat(f.severity()).isEqualTo(Severity.ERROR);
            assertThat(f.path()).isEqualTo("Bundle.entry[1].resource.subject.reference");
            assertThat(f.isBlocking()).isTrue();
        });
    }

    @Test
    void unresolvedReferenceIsWarningWhenExternalAllowed() {
        FhirRecord record = bundleOf(PATIENT, observationReferring("https://other.example.org/fhir/Patient/x"));

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.ALLOW_EXTERNAL).validate(record))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.severity()).isEqualTo(Severity.WARNING);
                    assertThat(f.isBlocking()).isFalse();
                });
    }

    @Test
    void absoluteUrlResolvesThroughTrailingTypeAndId() {
        FhirRecord record = bundleOf(PATIENT, observationReferring("https://example.org/fhir/Patient/p1"));

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.IN_BUNDLE_ONLY).validate(record)).isEmpty();
    }

    @Test
    void declaredTypeMismatchIsAlwaysError() {
        FhirRecord record = bundleOf(PATIENT, """
                {"resourceType": "Observation", "id": "o1",
                 "subject": {"reference": "Patient/p1", "type": "Group"}}""");

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.ALLOW_EXTERNAL).validate(record))
                .singleElement()
                .satisfies(f -> {
                    assertThat(f.errorCode()).isEqualTo(ErrorCodes.REFERENCE_TYPE_MISMATCH);
                    assertThat(f.severity()).isEqualTo(Severity.ERROR);
                    assertThat(f.details()).containsEntry("expectedType", "Group").containsEntry("actualType", "Patient");
                });
    }

    @Test
    void containedReferencesAreNotChecked() {
        FhirRecord record = bundleOf(observationReferring("#contained-1"));

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.IN_BUNDLE_ONLY).validate(record)).isEmpty();
    }

    @Test
    void sameReferenceInOneResourceIsReportedOnce() {
        FhirRecord record = bundleOf("""
                {"resourceType": "Observation", "id": "o1",
                 "subject": {"reference": "Patient/gone"}, "performer": [{"reference": "Patient/gone"}]}""");

        assertThat(new ReferenceIntegrityLayer(ReferencePolicy.IN_BUNDLE_ONLY).validate(record)).hasSize(1);
    }
}
