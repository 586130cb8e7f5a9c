package io.fhirrules.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.error.RecordFormatException;
import java.util.ArrayList;
import java.util.List;

/**
 * A parsed record: either a {@code Bundle}, whose entries are its resource
 * instances, or a single resource. Entries are exposed in document order.
 *
 * <p>
 * Thread-safe and immutable once constructed; the wrapped tree must not be
 * mutated by callers.
 */
public final class FhirRecord {

    private final JsonNode root;
    private final String rootType;
    private final List<Location> entries;

    private FhirRecord(JsonNode root, String rootType, List<Location> entries) {
        this.root = root;
        this.rootType = rootType;
        this.entries = List.copyOf(entries);
    }

    /**
     * Wraps a parsed record.
     *
     * @throws RecordFormatException if the root is not an object with a
     *                               {@code resourceType}
     */
    public static FhirRecord of(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new RecordFormatException("Record must be a JSON object");
        }
        String rootType = root.path("resourceType").asText("");
        if (rootType.isEmpty()) {
            throw new RecordFormatException("Record has no resourceType");
        }
        List<Location> entries = new ArrayList<>();
        if ("Bundle".equals(rootType)) {
            JsonNode entryArray = root.path("entry");
            for (int i = 0; i < entryArray.size(); i++) {
                JsonNode entry = entryArray.get(i);
                JsonNode resource = entry.path("resource");
                if (!resource.isObject() || !resource.hasNonNull("resourceType")) {
                    continue;
                }
                entries.add(new Location(
                        resource.get("resourceType").asText(),
                        i,
                        "Bundle.entry[" + i + "].resource",
                        textOrNull(resource, "id"),
                        textOrNull(entry, "fullUrl"),
                        resource));
            }
        } else {
            entries.add(new Location(rootType, 0, rootType, textOrNull(root, "id"), null, root));
        }
        return new FhirRecord(root, rootType, entries);
    }

    public JsonNode root() {
        return root;
    }

    /** The root resource type, e.g. {@code Bundle}. */
    public String rootType() {
        return rootType;
    }

    public boolean isBundle() {
        return "Bundle".equals(rootType);
    }

    /** The root's {@code id}, or {@code null}. */
    public String id() {
        return textOrNull(root, "id");
    }

    /** All resource instances in document order. */
    public List<Location> entries() {
        return entries;
    }

    /** Instances of the given type in document order; empty if there are none. */
    public List<Location> instancesOf(String resourceType) {
        return entries.stream().filter(e -> e.resourceType().equals(resourceType)).toList();
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
