package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleEngineException;
import io.fhirrules.core.path.PathExpression;
import io.fhirrules.core.path.PathExpression.Segment;
import io.fhirrules.core.path.PathExpression.SegmentKind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Walks a resource along a {@link PathExpression}.
 *
 * <p>
 * Arrays fan out: every element becomes its own {@link PathValue} with the
 * index in its concrete path. {@code [n]} selects one element and {@code [*]}
 * is the same as no marker. A segment naming a choice element resolves the
 * typed variant, so {@code value} finds {@code valueQuantity}. Missing and
 * JSON-null values are skipped.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RecordNavigator {

    private RecordNavigator() {}

    /**
     * Selects all values at {@code path} below {@code context}.
     *
     * @param context  the node to start from
     * @param path     a navigable path
     * @param basePath the concrete path of {@code context}
     * @return the selected values in document order
     * @throws InvalidPathExpressionException if the path contains a function
     *                                        or {@code where} segment
     */
    public static List<PathValue> select(JsonNode context, PathExpression path, String basePath) {
        List<PathValue> current = new ArrayList<>();
        current.add(new PathValue(basePath, context));
        for (Segment segment : path.segments()) {
            if (segment.kind() != SegmentKind.FIELD) {
                throw new InvalidPathExpressionException(
                        "Path '" + path + "' cannot be navigated: segment '" + segment.text() + "' is not a field",
                        path.text(),
                        null,
                        RuleEngineException.Phase.EVALUATION);
            }
            List<PathValue> next = new ArrayList<>();
            for (PathValue pv : current) {
                step(pv, segment, next);
            }
            current = next;
            if (current.isEmpty()) {
                break;
            }
        }
        return current;
    }

    /** Selects values and returns only the nodes. */
    public static List<JsonNode> values(JsonNode context, PathExpression path) {
        return select(context, path, "").stream().map(PathValue::value).toList();
    }

    private static void step(PathValue from, Segment segment, List<PathValue> out) {
        JsonNode node = from.value();
        if (!node.isObject()) {
            return;
        }
        String fieldName = segment.name();
        JsonNode child = node.get(fieldName);
        if (child == null) {
            fieldName = choiceVariant(node, segment.name());
            child = fieldName == null ? null : node.get(fieldName);
        }
        if (child == null || child.isNull()) {
            return;
        }
        String base = from.path().isEmpty() ? fieldName : from.path() + "." + fieldName;
        if (child.isArray()) {
            for (int i = 0; i < child.size(); i++) {
                if (segment.index() != null && segment.index() != i) {
                    continue;
                }
                JsonNode element = child.get(i);
                if (!element.isNull()) {
                    out.add(new PathValue(base + "[" + i + "]", element));
                }
            }
        } else if (segment.index() == null || segment.index() == 0) {
            out.add(new PathValue(base, child));
        }
    }

    /** Finds {@code nameXxx} where {@code Xxx} starts upper-case. */
    private static String choiceVariant(JsonNode node, String name) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String candidate = names.next();
            if (candidate.length() > name.length()
                    && candidate.startsWith(name)
                    && Character.isUpperCase(candidate.charAt(name.length()))) {
                return candidate;
            }
        }
        return null;
    }
}
