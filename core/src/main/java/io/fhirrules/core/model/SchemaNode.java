package io.fhirrules.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Node of a schema tree for one resource type. The root node's {@code name} is
 * the resource type.
 *
 * @param path     dot path as delivered by the schema provider
 * @param name     element name
 * @param type     element data type, e.g. {@code HumanName}
 * @param min      minimum cardinality
 * @param max      maximum cardinality, {@code "*"} for unbounded
 * @param children child elements in schema order
 */
public record SchemaNode(String path, String name, String type, int min, String max, List<SchemaNode> children) {

    public SchemaNode {
        Objects.requireNonNull(name, "name must not be null");
        children = children == null ? List.of() : List.copyOf(children);
        max = max == null ? "1" : max;
    }

    /** Leaf node with cardinality {@code 0..1}. */
    public static SchemaNode leaf(String name, String type) {
        return new SchemaNode(name, name, type, 0, "1", List.of());
    }

    /** Whether the element repeats. */
    public boolean isArray() {
        return "*".equals(max) || (!max.isEmpty() && max.chars().allMatch(Character::isDigit) && Integer.parseInt(max) > 1);
    }
}
