package io.fhirrules.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.path.PredicateParser;
import io.fhirrules.core.testkit.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PredicateEvaluator")
class PredicateEvaluatorTest {

    private static final JsonNode PATIENT = TestRecords.json("""
            {
              "resourceType": "Patient",
              "active": true,
              "gender": "female",
              "name": [{"family": "Tan"}, {"family": "Lim"}],
              "telecom": [],
              "multipleBirthInteger": 2
            }""");

    private static boolean eval(String expression) {
        return PredicateEvaluator.test(PredicateParser.parse(expression), PATIENT);
    }

    @Test
    void comparisonsAreExistentialOverArrays() {
        assertThat(eval("name.family = 'Lim'")).isTrue();
        assertThat(eval("name.family = 'Ong'")).isFalse();
    }

    @Test
    void notEqualsHoldsWhenNoValueEquals() {
        assertThat(eval("name.family != 'Ong'")).isTrue();
        assertThat(eval("name.family != 'Tan'")).isFalse();
        assertThat(eval("deceasedBoolean != true")).isTrue();
    }

    @Test
    void comparesNumbersAndBooleansByType() {
        assertThat(eval("multipleBirthInteger >= 2")).isTrue();
        assertThat(eval("multipleBirthInteger < 2")).isFalse();
        assertThat(eval("active = true")).isTrue();
        assertThat(eval("active = 'true'")).isFalse();
    }

    @Test
    void existsAndEmptyIgnoreBlankValues() {
        assertThat(eval("gender.exists()")).isTrue();
        assertThat(eval("telecom.exists()")).isFalse();
        assertThat(eval("birthDate.empty()")).isTrue();
    }

    @Test
    void countComparesSelectedItems() {
        assertThat(eval("name.count() = 2")).isTrue();
        assertThat(eval("name.count() > 2")).isFalse();
    }

    @Test
    void booleanConnectives() {
        assertThat(eval("gender = 'male' or name.count() = 2")).isTrue();
        assertThat(eval("gender = 'female' and not active = true")).isFalse();
    }
}
