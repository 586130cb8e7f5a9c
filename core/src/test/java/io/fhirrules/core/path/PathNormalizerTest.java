package io.fhirrules.core.path;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("PathNormalizer")
class PathNormalizerTest {

    @Nested
    @DisplayName("rewrites")
    class Rewrites {

        @Test
        void stripsResourcePrefixOnlyForOwningType() {
            assertThat(PathNormalizer.normalize("Patient.birthDate", "Patient")).isEqualTo("birthDate");
            assertThat(PathNormalizer.normalize("Patient.birthDate", "Observation"))
                    .isEqualTo("Patient.birthDate");
            assertThat(PathNormalizer.normalize("Patient.birthDate")).isEqualTo("Patient.birthDate");
        }

        @Test
        void dropsConcreteIndexesButKeepsWildcards() {
            assertThat(PathNormalizer.normalize("identifier[0].system")).isEqualTo("identifier.system");
            assertThat(PathNormalizer.normalize("identifier[*].system")).isEqualTo("identifier[*].system");
        }

        @Test
        void collapsesInnerAndTrailingWhereClauses() {
            assertThat(PathNormalizer.normalize("identifier.where(system='nric').value"))
                    .isEqualTo("identifier.value");
            assertThat(PathNormalizer.normalize("telecom.where(system='phone')")).isEqualTo("telecom");
        }

        @Test
        void collapsesChainedWhereClauses() {
            assertThat(PathNormalizer.normalize("a.where(x='1').where(y='2').b")).isEqualTo("a.b");
        }

        @Test
        void collapsesWhereClausesWithNestedParentheses() {
            assertThat(PathNormalizer.normalize("Patient.name.where(given.empty()).family", "Patient"))
                    .isEqualTo("name.family");
            assertThat(PathNormalizer.normalize("link.where(url.startsWith('x')).value")).isEqualTo("link.value");
            assertThat(PathNormalizer.normalize("name.where(given.exists() and family.empty())"))
                    .isEqualTo("name");
        }

        @Test
        void parenthesisInsideQuotedLiteralDoesNotCloseTheClause() {
            assertThat(PathNormalizer.normalize("telecom.where(value='(65) 555').system"))
                    .isEqualTo("telecom.system");
        }

        @Test
        void unterminatedWhereClauseIsLeftInPlace() {
            assertThat(PathNormalizer.normalize("name.where(given.empty().family"))
                    .isEqualTo("name.where(given.empty().family");
        }

        @Test
        void stripsCountAndExists() {
            assertThat(PathNormalizer.normalize("name.count()")).isEqualTo("name");
            assertThat(PathNormalizer.normalize("Patient.telecom.exists()", "Patient")).isEqualTo("telecom");
        }

        @Test
        void trimsAndMapsBlankToEmpty() {
            assertThat(PathNormalizer.normalize("  gender  ")).isEqualTo("gender");
            assertThat(PathNormalizer.normalize(null)).isEmpty();
            assertThat(PathNormalizer.normalize("   ")).isEmpty();
        }
    }

    @ParameterizedTest(name = "normalize is idempotent for \"{0}\"")
    @ValueSource(strings = {
        "birthDate",
        "Patient.identifier[0].system",
        "identifier[*].value",
        "identifier.where(system='nric').value",
        "a.where(x='1').where(y='2').b",
        "telecom.where(system='phone')",
        "name.where(given.empty()).family",
        "name.count()",
        "component[1].value.exists()"
    })
    void normalizationIsIdempotent(String path) {
        String once = PathNormalizer.normalize(path, "Patient");
        assertThat(PathNormalizer.normalize(once, "Patient")).isEqualTo(once);
    }

    @Test
    void stripWildcardsRemovesEveryMarker() {
        assertThat(PathNormalizer.stripWildcards("component[*].code.coding[*].code"))
                .isEqualTo("component.code.coding.code");
        assertThat(PathNormalizer.stripWildcards(null)).isEmpty();
    }
}
