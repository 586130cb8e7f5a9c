package io.fhirrules.core.coverage;

import io.fhirrules.core.model.SchemaNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens a schema tree into resource-relative dot paths, in pre-order. The
 * root (the resource itself) is not included.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class SchemaFlattener {

    private SchemaFlattener() {}

    public static List<String> flatten(SchemaNode root) {
        List<String> paths = new ArrayList<>();
        for (SchemaNode child : root.children()) {
            walk(child, "", paths);
        }
        return paths;
    }

    private static void walk(SchemaNode node, String parentPath, List<String> paths) {
        String path = parentPath.isEmpty() ? node.name() : parentPath + "." + node.name();
        paths.add(path);
        for (SchemaNode child : node.children()) {
            walk(child, path, paths);
        }
    }
}
