package io.fhirrules.core.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fhirrules.core.model.FhirRecord;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Builders for records used across tests.
 */
public final class TestRecords {

    public static final ObjectMapper JSON = new ObjectMapper();

    private TestRecords() {}

    /** Parses inline JSON. */
    public static JsonNode json(String text) {
        try {
            return JSON.readTree(text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Wraps inline JSON as a record. */
    public static FhirRecord record(String text) {
        return FhirRecord.of(json(text));
    }

    /** Loads a JSON record from the test classpath. */
    public static FhirRecord fromClasspath(String resource) {
        try (InputStream in = TestRecords.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("Test resource not found: " + resource);
            }
            return FhirRecord.of(JSON.readTree(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** A collection bundle whose entries are the given resources, without fullUrls. */
    public static FhirRecord bundleOf(String... resources) {
        ObjectNode bundle = JSON.createObjectNode();
        bundle.put("resourceType", "Bundle");
        bundle.put("id", "test-bundle");
        bundle.put("type", "collection");
        ArrayNode entries = bundle.putArray("entry");
        for (String resource : resources) {
            entries.addObject().set("resource", json(resource));
        }
        return FhirRecord.of(bundle);
    }
}
