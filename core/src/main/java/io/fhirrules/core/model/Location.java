package io.fhirrules.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Objects;

/**
 * One resource instance of a record, as a rule sees it.
 *
 * @param resourceType the instance's {@code resourceType}
 * @param entryIndex   index of the bundle entry, 0 for a standalone resource
 * @param path         concrete path prefix of the instance, e.g.
 *                     {@code Bundle.entry[2].resource} or {@code Patient}
 * @param resourceId   the instance's {@code id}, or {@code null}
 * @param fullUrl      the bundle entry's {@code fullUrl}, or {@code null}
 * @param resource     the instance node
 */
public record Location(
        String resourceType, int entryIndex, String path, String resourceId, String fullUrl, JsonNode resource) {

    public Location {
        Objects.requireNonNull(resourceType, "resourceType must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(resource, "resource must not be null");
    }

    /** Concrete path of a value below this instance. */
    public String pathOf(String relativePath) {
        return relativePath == null || relativePath.isEmpty() ? path : path + "." + relativePath;
    }
}
