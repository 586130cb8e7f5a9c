package io.fhirrules.core.coverage;

import static org.assertj.core.api.Assertions.assertThat;

import io.fhirrules.core.model.SchemaNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaFlattenerTest {

    @Test
    void flattensInPreOrderWithoutRoot() {
        SchemaNode patient = new SchemaNode("Patient", "Patient", "Patient", 0, "*", List.of(
                new SchemaNode("Patient.name", "name", "HumanName", 0, "*", List.of(
                        SchemaNode.leaf("family", "string"), SchemaNode.leaf("given", "string"))),
                SchemaNode.leaf("gender", "code")));

        assertThat(SchemaFlattener.flatten(patient)).containsExactly("name", "name.family", "name.given", "gender");
    }

    @Test
    void rootWithoutChildrenFlattensToNothing() {
        assertThat(SchemaFlattener.flatten(SchemaNode.leaf("Basic", "Basic"))).isEmpty();
    }
}
