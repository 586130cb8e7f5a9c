package io.fhirrules.core.path;

import io.fhirrules.core.error.InvalidPathExpressionException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed path in the constrained grammar: dot-separated segments, each an
 * identifier optionally followed by {@code [n]} or {@code [*]}.
 *
 * <p>
 * The parser also recognises the function segments {@code exists()},
 * {@code count()}, {@code empty()} and {@code where(...)} so that normalisation
 * and governance can see them. A path containing them is grammatical but not
 * in stored form, and cannot be navigated against a record.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class PathExpression {

    /** Kind of a single path segment. */
    public enum SegmentKind {
        FIELD,
        FUNCTION,
        WHERE
    }

    /**
     * One segment. For {@link SegmentKind#FIELD}: {@code index} is the concrete
     * index or {@code null}; {@code wildcard} is true for {@code [*]}. For
     * {@link SegmentKind#WHERE}: {@code argument} is the raw clause body.
     */
    public record Segment(SegmentKind kind, String name, Integer index, boolean wildcard, String argument) {

        /** Renders the segment back to its textual form. */
        public String text() {
            return switch (kind) {
                case FIELD -> name + (wildcard ? "[*]" : index != null ? "[" + index + "]" : "");
                case FUNCTION -> name + "()";
                case WHERE -> "where(" + argument + ")";
            };
        }
    }

    private static final Pattern FIELD_SEGMENT =
            Pattern.compile("([A-Za-z_][A-Za-z0-9_]*)(?:\\[(\\*|\\d+)])?");
    private static final Pattern FUNCTION_SEGMENT = Pattern.compile("(exists|count|empty)\\(\\)");

    private final String text;
    private final List<Segment> segments;

    private PathExpression(String text, List<Segment> segments) {
        this.text = text;
        this.segments = List.copyOf(segments);
    }

    /**
     * Parses a path.
     *
     * @param path the path text; surrounding whitespace is ignored
     * @return the parsed expression
     * @throws InvalidPathExpressionException if the path is blank or not in the
     *                                        grammar
     */
    public static PathExpression parse(String path) {
        if (path == null || path.isBlank()) {
            throw new InvalidPathExpressionException("Path must not be blank", path);
        }
        String trimmed = path.trim();
        List<String> parts = splitTopLevel(trimmed);
        List<Segment> segments = new ArrayList<>(parts.size());
        for (String part : parts) {
            segments.add(parseSegment(part, trimmed));
        }
        if (segments.get(0).kind() != SegmentKind.FIELD) {
            throw new InvalidPathExpressionException(
                    "Path '" + trimmed + "' must start with a field name", trimmed);
        }
        return new PathExpression(trimmed, segments);
    }

    /** Returns {@code true} when {@link #parse(String)} would accept the path. */
    public static boolean isValid(String path) {
        try {
            parse(path);
            return true;
        } catch (InvalidPathExpressionException e) {
            return false;
        }
    }

    public String text() {
        return text;
    }

    public List<Segment> segments() {
        return segments;
    }

    /** Name of the first segment. */
    public String firstSegmentName() {
        return segments.get(0).name();
    }

    /** Whether any segment carries a concrete {@code [n]} index. */
    public boolean hasIndexMarker() {
        return segments.stream().anyMatch(s -> s.index() != null);
    }

    /** Whether any segment carries the {@code [*]} marker. */
    public boolean hasWildcard() {
        return segments.stream().anyMatch(Segment::wildcard);
    }

    /** Whether the path embeds a {@code where(...)} clause. */
    public boolean hasFilterClause() {
        return segments.stream().anyMatch(s -> s.kind() == SegmentKind.WHERE);
    }

    /** Whether the path embeds {@code exists()}, {@code count()} or {@code empty()}. */
    public boolean hasFunction() {
        return segments.stream().anyMatch(s -> s.kind() == SegmentKind.FUNCTION);
    }

    /** Whether every segment is a plain field, so the path can be navigated. */
    public boolean isNavigable() {
        return !hasFilterClause() && !hasFunction();
    }

    // --- Private helpers ---

    private static Segment parseSegment(String part, String whole) {
        if (part.isEmpty()) {
            throw new InvalidPathExpressionException("Path '" + whole + "' has an empty segment", whole);
        }
        Matcher field = FIELD_SEGMENT.matcher(part);
        if (field.matches()) {
            String marker = field.group(2);
            if (marker == null) {
                return new Segment(SegmentKind.FIELD, field.group(1), null, false, null);
            }
            if ("*".equals(marker)) {
                return new Segment(SegmentKind.FIELD, field.group(1), null, true, null);
            }
            try {
                return new Segment(SegmentKind.FIELD, field.group(1), Integer.parseInt(marker), false, null);
            } catch (NumberFormatException e) {
                throw new InvalidPathExpressionException(
                        "Path '" + whole + "' has an index out of range: " + part, whole);
            }
        }
        Matcher function = FUNCTION_SEGMENT.matcher(part);
        if (function.matches()) {
            return new Segment(SegmentKind.FUNCTION, function.group(1), null, false, null);
        }
        if (part.startsWith("where(") && part.endsWith(")")) {
            String body = part.substring("where(".length(), part.length() - 1).trim();
            if (body.isEmpty()) {
                throw new InvalidPathExpressionException("Path '" + whole + "' has an empty where() clause", whole);
            }
            return new Segment(SegmentKind.WHERE, "where", null, false, body);
        }
        throw new InvalidPathExpressionException(
                "Path '" + whole + "' has an invalid segment '" + part + "'", whole);
    }

    /** Splits on dots that are outside parentheses and quotes. */
    private static List<String> splitTopLevel(String path) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inQuote = false;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote && c == '(') {
                depth++;
            } else if (!inQuote && c == ')') {
                depth--;
                if (depth < 0) {
                    throw new InvalidPathExpressionException("Path '" + path + "' has unbalanced parentheses", path);
                }
            } else if (!inQuote && depth == 0 && c == '.') {
                parts.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (depth != 0 || inQuote) {
            throw new InvalidPathExpressionException(
                    "Path '" + path + "' has unbalanced parentheses or quotes", path);
        }
        parts.add(current.toString().trim());
        return parts;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathExpression other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
