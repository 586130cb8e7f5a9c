package io.fhirrules.core.engine.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.SchemaNode;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Advisory hints from the base specification: a top-level element whose
 * schema cardinality is {@code 1..} but which is absent from an instance.
 * Choice elements ({@code value[x]}) are present when any typed variant is.
 */
public final class SpecHintLayer implements ValidationLayer {

    private final Map<String, SchemaNode> schemas;

    /**
     * @param schemas schema tree per resource type; types without a tree get no
     *                hints
     */
    public SpecHintLayer(Map<String, SchemaNode> schemas) {
        this.schemas = Map.copyOf(schemas);
    }

    @Override
    public FindingSource source() {
        return FindingSource.SPEC_HINT;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        List<Finding> findings = new ArrayList<>();
        for (Location entry : record.entries()) {
            SchemaNode schema = schemas.get(entry.resourceType());
            if (schema == null) {
                continue;
            }
            for (SchemaNode child : schema.children()) {
                if (child.min() >= 1 && !isPresent(entry.resource(), child.name())) {
                    findings.add(new Finding(
                            FindingSource.SPEC_HINT,
                            Severity.WARNING,
                            entry.pathOf(child.name()),
                            entry.resourceType() + "." + child.name() + " is required by the base specification",
                            ErrorCodes.SPEC_HINT_REQUIRED_ELEMENT,
                            null,
                            entry.resourceType(),
                            Map.of("element", child.name(), "min", child.min())));
                }
            }
        }
        return findings;
    }

    private static boolean isPresent(JsonNode resource, String elementName) {
        if (elementName.endsWith("[x]")) {
            String prefix = elementName.substring(0, elementName.length() - 3);
            Iterator<String> names = resource.fieldNames();
            while (names.hasNext()) {
                String name = names.next();
                if (name.startsWith(prefix) && name.length() > prefix.length()) {
                    return true;
                }
            }
            return false;
        }
        JsonNode value = resource.get(elementName);
        return value != null && !value.isNull();
    }
}
