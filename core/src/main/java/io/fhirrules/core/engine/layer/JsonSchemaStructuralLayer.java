package io.fhirrules.core.engine.layer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.fhirrules.core.error.ConfigLoadException;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.spi.ValidationLayer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Structural layer backed by a JSON Schema (draft 2020-12). Every schema
 * violation becomes one {@code STRUCTURE_INVALID} error at the violating
 * instance location.
 *
 * <p>
 * The compiled schema is immutable; the layer is thread-safe.
 */
public final class JsonSchemaStructuralLayer implements ValidationLayer {

    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonSchema schema;

    public JsonSchemaStructuralLayer(JsonNode schemaNode) {
        Objects.requireNonNull(schemaNode, "schemaNode must not be null");
        this.schema = SCHEMA_FACTORY.getSchema(schemaNode);
    }

    /**
     * Loads the schema from a JSON file.
     *
     * @throws ConfigLoadException if the file cannot be read
     */
    public static JsonSchemaStructuralLayer fromFile(Path schemaFile) {
        try {
            return new JsonSchemaStructuralLayer(MAPPER.readTree(schemaFile.toFile()));
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read structural schema: " + schemaFile, e);
        }
    }

    @Override
    public FindingSource source() {
        return FindingSource.STRUCTURAL;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        Set<ValidationMessage> messages = schema.validate(record.root());
        return messages.stream()
                .sorted(Comparator.comparing((ValidationMessage m) -> m.getInstanceLocation().toString())
                        .thenComparing(ValidationMessage::getMessage))
                .map(m -> new Finding(
                        FindingSource.STRUCTURAL,
                        Severity.ERROR,
                        m.getInstanceLocation().toString(),
                        m.getMessage(),
                        ErrorCodes.STRUCTURE_INVALID,
                        null,
                        null,
                        Map.of("keyword", String.valueOf(m.getType()))))
                .toList();
    }
}
