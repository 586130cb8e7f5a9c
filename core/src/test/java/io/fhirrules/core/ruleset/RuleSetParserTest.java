package io.fhirrules.core.ruleset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleConfigurationException;
import io.fhirrules.core.error.RuleEngineException;
import io.fhirrules.core.error.RuleSetParseException;
import io.fhirrules.core.model.AnswerConstraint;
import io.fhirrules.core.model.InstanceScope;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.model.RuleType;
import io.fhirrules.core.model.Severity;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link RuleSetParser}: loading rule-set YAML into typed rules,
 * and rejecting malformed files with the rule and source that failed.
 */
@DisplayName("RuleSetParser")
class RuleSetParserTest {

    private static Path resource(String name) throws URISyntaxException {
        return Path.of(RuleSetParserTest.class.getClassLoader().getResource(name).toURI());
    }

    @Nested
    @DisplayName("valid rule sets")
    class Valid {

        @Test
        void loadsEveryRuleOfTheFixture() throws URISyntaxException {
            RuleSet ruleSet = RuleSetParser.parse(resource("rulesets/patient-core.yaml"));

            assertThat(ruleSet.id()).isEqualTo("patient-core");
            assertThat(ruleSet.version()).isEqualTo("1.0.0");
            assertThat(ruleSet.rules()).extracting(Rule::id).containsExactly(
                    "patient-birthdate",
                    "patient-gender",
                    "patient-nric",
                    "patient-name-count",
                    "hearing-status",
                    "bundle-composition",
                    "hearing-answers");
            assertThat(ruleSet.rules()).extracting(Rule::type).containsExactly(
                    RuleType.REQUIRED,
                    RuleType.ALLOWED_VALUES,
                    RuleType.REGEX,
                    RuleType.ARRAY_LENGTH,
                    RuleType.FIXED_VALUE,
                    RuleType.RESOURCE_COMPOSITION,
                    RuleType.QUESTION_ANSWER);
        }

        @Test
        void mapsScopesParamsAndHints() throws URISyntaxException {
            RuleSet ruleSet = RuleSetParser.parse(resource("rulesets/patient-core.yaml"));

            Rule birthDate = ruleSet.rules().get(0);
            assertThat(birthDate.scope()).isEqualTo(InstanceScope.FIRST);
            assertThat(birthDate.severity()).isEqualTo(Severity.ERROR);

            Rule nric = ruleSet.rules().get(2);
            assertThat(nric.params()).isInstanceOfSatisfying(RuleParams.RegexParams.class, p -> {
                assertThat(p.pattern()).isEqualTo("^[STFG]\\d{7}[A-Z]$");
                assertThat(p.negate()).isFalse();
            });
            assertThat(nric.hint()).isEqualTo("NRIC must be a valid identity number");

            Rule status = ruleSet.rules().get(4);
            assertThat(status.scope()).isInstanceOf(InstanceScope.Filtered.class);
            assertThat(status.scope().stableKey()).contains("HS");

            Rule composition = ruleSet.rules().get(5);
            assertThat(composition.fieldPath()).isNull();
            assertThat(composition.params()).isInstanceOfSatisfying(
                    RuleParams.ResourceCompositionParams.class, p -> {
                        assertThat(p.requirements()).hasSize(2);
                        assertThat(p.requirements().get(1).where()).hasSize(1);
                        assertThat(p.rejectUndeclared()).isFalse();
                    });

            Rule answers = ruleSet.rules().get(6);
            assertThat(answers.params()).isInstanceOfSatisfying(RuleParams.QuestionAnswerParams.class, p -> {
                assertThat(p.questionSetId()).isEqualTo("hearing");
                assertThat(p.constraint()).isEqualTo(AnswerConstraint.REQUIRED);
            });
        }

        @Test
        void minimalInlineRuleSetUsesDefaults() {
            RuleSet ruleSet = RuleSetParser.parse("""
                    ruleset: minimal
                    rules:
                      - id: r1
                        type: Required
                        resourceType: Patient
                        fieldPath: gender
                    """, "inline");

            Rule rule = ruleSet.rules().get(0);
            assertThat(ruleSet.version()).isNull();
            assertThat(rule.scope()).isEqualTo(InstanceScope.ALL);
            assertThat(rule.enabled()).isTrue();
            assertThat(rule.errorCode()).isEqualTo("FIELD_REQUIRED");
        }
    }

    @Nested
    @DisplayName("invalid rule sets")
    class Invalid {

        @Test
        void unknownRuleKeyIsRejected() throws URISyntaxException {
            Path file = resource("rulesets/unknown-key.yaml");

            assertThatThrownBy(() -> RuleSetParser.parse(file))
                    .isInstanceOfSatisfying(RuleSetParseException.class, e -> {
                        assertThat(e.ruleId()).isEqualTo("r1");
                        assertThat(e.source()).isEqualTo(file.toString());
                        assertThat(e.phase()).isEqualTo(RuleEngineException.Phase.LOAD);
                    })
                    .hasMessageContaining("unknown key 'mandatory'");
        }

        @Test
        void unknownTypeNamesTheRule() {
            assertThatThrownBy(() -> RuleSetParser.parse("""
                    ruleset: bad
                    rules:
                      - id: r1
                        type: Mandatory
                        resourceType: Patient
                        fieldPath: gender
                    """, "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageStartingWith("r1: ")
                    .hasMessageContaining("Mandatory");
        }

        @Test
        void unknownScopeIsRejected() {
            assertThatThrownBy(() -> RuleSetParser.parse("""
                    ruleset: bad
                    rules:
                      - id: r1
                        type: Required
                        resourceType: Patient
                        fieldPath: gender
                        scope: last
                    """, "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("unknown scope 'last'");
        }

        @Test
        void malformedPathIsWrappedWithItsCause() {
            assertThatThrownBy(() -> RuleSetParser.parse("""
                    rules:
                      - type: Required
                        resourceType: Patient
                        fieldPath: "name..family"
                    ruleset: bad
                    """, "inline"))
                    .isInstanceOfSatisfying(RuleSetParseException.class, e -> {
                        assertThat(e.ruleId()).isEqualTo("rules[0]");
                        assertThat(e.getCause()).isInstanceOf(InvalidPathExpressionException.class);
                    });
        }

        @Test
        void paramsOfWrongShapeAreRejected() {
            assertThatThrownBy(() -> RuleSetParser.parse("""
                    ruleset: bad
                    rules:
                      - id: len
                        type: ArrayLength
                        resourceType: Patient
                        fieldPath: name
                        params: {}
                    """, "inline"))
                    .isInstanceOfSatisfying(RuleSetParseException.class,
                            e -> assertThat(e.getCause()).isInstanceOf(RuleConfigurationException.class))
                    .hasMessageContaining("'min' or 'max'");
        }

        @Test
        void duplicateRuleIdsAreRejected() {
            assertThatThrownBy(() -> RuleSetParser.parse("""
                    ruleset: dupes
                    rules:
                      - {id: r1, type: Required, resourceType: Patient, fieldPath: gender}
                      - {id: r1, type: Required, resourceType: Patient, fieldPath: birthDate}
                    """, "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("twice");
        }

        @Test
        void missingRulesArrayIsRejected() {
            assertThatThrownBy(() -> RuleSetParser.parse("ruleset: empty\n", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("'rules' array");
        }

        @Test
        void invalidYamlIsRejected() {
            assertThatThrownBy(() -> RuleSetParser.parse("ruleset: [unclosed", "inline"))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("Failed to parse rule set YAML");
        }

        @Test
        void missingFileIsRejected(@TempDir Path dir) {
            assertThatThrownBy(() -> RuleSetParser.parse(dir.resolve("absent.yaml")))
                    .isInstanceOf(RuleSetParseException.class)
                    .hasMessageContaining("Failed to read rule set");
        }

        @Test
        void readsFromDisk(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("disk.yaml");
            Files.writeString(file, """
                    ruleset: disk
                    rules:
                      - {id: r1, type: Required, resourceType: Patient, fieldPath: gender, enabled: false}
                    """);

            assertThat(RuleSetParser.parse(file).rules().get(0).enabled()).isFalse();
        }
    }
}
