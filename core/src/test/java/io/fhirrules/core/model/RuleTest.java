package io.fhirrules.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.TextNode;
import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleConfigurationException;
import io.fhirrules.core.path.PathExpression;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Rule construction")
class RuleTest {

    private static Rule.Builder required(String path) {
        return Rule.builder()
                .id("r1")
                .resourceType("Patient")
                .fieldPath(path)
                .params(new RuleParams.RequiredParams());
    }

    @Nested
    @DisplayName("defaults")
    class Defaults {

        @Test
        void appliesScopeSeverityAndFixedErrorCode() {
            Rule rule = required("birthDate").build();

            assertThat(rule.scope()).isEqualTo(InstanceScope.ALL);
            assertThat(rule.severity()).isEqualTo(Severity.ERROR);
            assertThat(rule.errorCode()).isEqualTo(ErrorCodes.FIELD_REQUIRED);
            assertThat(rule.enabled()).isTrue();
            assertThat(rule.type()).isEqualTo(RuleType.REQUIRED);
        }

        @Test
        void questionAnswerCodeFollowsConstraint() {
            Rule rule = Rule.builder()
                    .id("qa")
                    .resourceType("Observation")
                    .fieldPath("component")
                    .params(new RuleParams.QuestionAnswerParams(
                            "hearing",
                            PathExpression.parse("component"),
                            PathExpression.parse("code.coding"),
                            PathExpression.parse("value"),
                            AnswerConstraint.RANGE))
                    .build();

            assertThat(rule.errorCode()).isEqualTo(ErrorCodes.ANSWER_OUT_OF_RANGE);
        }
    }

    @Nested
    @DisplayName("error-code vocabulary")
    class ErrorCodeVocabulary {

        @Test
        void rejectsForeignCodeOnFixedCodeType() {
            assertThatThrownBy(() -> required("birthDate").errorCode("PATTERN_MISMATCH").build())
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("FIELD_REQUIRED");
        }

        @Test
        void acceptsMatchingFixedCode() {
            assertThat(required("birthDate").errorCode("FIELD_REQUIRED").build().errorCode())
                    .isEqualTo("FIELD_REQUIRED");
        }

        @Test
        void customExpressionNeedsGovernedCode() {
            Rule.Builder custom = Rule.builder()
                    .id("c1")
                    .resourceType("Patient")
                    .fieldPath("telecom")
                    .params(new RuleParams.CustomExpressionParams("telecom.exists()"));

            assertThatThrownBy(custom::build).isInstanceOf(RuleConfigurationException.class);
            assertThatThrownBy(() -> custom.errorCode("MADE_UP").build())
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("governed vocabulary");
            assertThat(custom.errorCode("CUSTOM_RULE_FAILED").build().errorCode()).isEqualTo("CUSTOM_RULE_FAILED");
        }
    }

    @Nested
    @DisplayName("params")
    class Params {

        @Test
        void arrayLengthWithoutBoundIsRejected() {
            assertThatThrownBy(() -> new RuleParams.ArrayLengthParams(null, null))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("at least one");
        }

        @Test
        void arrayLengthBoundsMustBeOrdered() {
            assertThatThrownBy(() -> new RuleParams.ArrayLengthParams(3, 1))
                    .isInstanceOf(RuleConfigurationException.class);
            assertThat(new RuleParams.ArrayLengthParams(null, 0).max()).isZero();
        }

        @Test
        void regexMustCompile() {
            assertThatThrownBy(() -> new RuleParams.RegexParams("[a-", false, false))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("does not compile");
        }

        @Test
        void allowedValuesMustBeNonEmpty() {
            assertThatThrownBy(() -> new RuleParams.AllowedValuesParams(List.of()))
                    .isInstanceOf(RuleConfigurationException.class);
            assertThatThrownBy(() -> new RuleParams.AllowedValuesParams(List.of("male", " ")))
                    .isInstanceOf(RuleConfigurationException.class);
        }

        @Test
        void fixedValueMustBeScalar() {
            assertThatThrownBy(() -> new RuleParams.FixedValueParams(null))
                    .isInstanceOf(RuleConfigurationException.class);
            assertThat(new RuleParams.FixedValueParams(TextNode.valueOf("male")).value().asText())
                    .isEqualTo("male");
        }

        @Test
        void compositionRejectsDuplicateRequirement() {
            assertThatThrownBy(() -> new RuleParams.ResourceCompositionParams(
                            List.of(ResourceRequirement.exactly("Patient", 1), ResourceRequirement.atLeast("Patient", 0)),
                            false))
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("twice");
        }

        @Test
        void paramsMustMatchDeclaredType() {
            assertThatThrownBy(() -> required("birthDate").type(RuleType.REGEX).build())
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("carries Required params");
        }
    }

    @Nested
    @DisplayName("field path")
    class FieldPath {

        @Test
        void requiredForFieldRules() {
            assertThatThrownBy(() -> required(null).build())
                    .isInstanceOf(RuleConfigurationException.class)
                    .hasMessageContaining("needs a fieldPath");
        }

        @Test
        void notRequiredForComposition() {
            Rule rule = Rule.builder()
                    .id("comp")
                    .resourceType("Bundle")
                    .params(new RuleParams.ResourceCompositionParams(
                            List.of(ResourceRequirement.exactly("Patient", 1)), false))
                    .build();

            assertThat(rule.fieldPath()).isNull();
            assertThat(rule.errorCode()).isEqualTo(ErrorCodes.RESOURCE_REQUIREMENT_VIOLATION);
        }

        @Test
        void malformedPathIsRejected() {
            assertThatThrownBy(() -> required("name..given").build())
                    .isInstanceOf(InvalidPathExpressionException.class);
        }

        @Test
        void grammaticalNonStoredPathIsAccepted() {
            Rule rule = required("Patient.identifier.where(system='nric').value").build();

            assertThat(rule.fieldPath().hasFilterClause()).isTrue();
        }
    }

    @Test
    void ruleSetRejectsDuplicateIds() {
        Rule rule = required("birthDate").build();

        assertThatThrownBy(() -> RuleSet.of("set", List.of(rule, rule)))
                .isInstanceOf(RuleConfigurationException.class)
                .hasMessageContaining("twice");
    }
}
