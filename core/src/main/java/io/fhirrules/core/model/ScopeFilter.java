package io.fhirrules.core.model;

import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.path.PathExpression;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Structural predicate selecting which instances participate in a rule or a
 * resource requirement: a resource-relative field path, a comparison and a
 * literal.
 *
 * <p>
 * The path must be navigable and must stay inside the resource. A path
 * starting at {@code Bundle} or {@code entry} is rejected on construction.
 *
 * @param fieldPath  resource-relative path of the compared value
 * @param comparison the comparison applied to the selected values
 * @param literal    the literal compared against; a comma-separated list for
 *                   {@link Comparison#IN}; {@code null} for
 *                   {@link Comparison#EXISTS} and {@link Comparison#NOT_EXISTS}
 */
public record ScopeFilter(PathExpression fieldPath, Comparison comparison, String literal) {

    /** Comparison operators. */
    public enum Comparison {
        EQUALS("="),
        NOT_EQUALS("!="),
        CONTAINS("contains"),
        IN("in"),
        EXISTS("exists"),
        NOT_EXISTS("not-exists");

        private final String symbol;

        Comparison(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /** Whether the comparison needs a literal. */
        public boolean takesLiteral() {
            return this != EXISTS && this != NOT_EXISTS;
        }

        /** @throws IllegalArgumentException if the symbol is unknown */
        public static Comparison fromSymbol(String symbol) {
            String s = symbol == null ? "" : symbol.trim();
            for (Comparison c : values()) {
                if (c.symbol.equalsIgnoreCase(s)) {
                    return c;
                }
            }
            throw new IllegalArgumentException("Unknown comparison '" + symbol + "'");
        }
    }

    private static final Pattern BINARY =
            Pattern.compile("^(.+?)\\s*(!=|=|\\s+contains\\s+|\\s+in\\s+)\\s*(.+)$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UNARY = Pattern.compile("^(.+)\\.(exists|empty)\\(\\)$");

    public ScopeFilter {
        Objects.requireNonNull(fieldPath, "fieldPath must not be null");
        Objects.requireNonNull(comparison, "comparison must not be null");
        if (!fieldPath.isNavigable()) {
            throw new InvalidPathExpressionException(
                    "Scope filter path '" + fieldPath + "' must be a plain field path", fieldPath.text());
        }
        String first = fieldPath.firstSegmentName();
        if ("Bundle".equals(first) || "entry".equals(first)) {
            throw new InvalidPathExpressionException(
                    "Scope filter path '" + fieldPath + "' must be relative to the resource, not the bundle",
                    fieldPath.text());
        }
        if (comparison.takesLiteral() && (literal == null || literal.isEmpty())) {
            throw new InvalidPathExpressionException(
                    "Scope filter on '" + fieldPath + "' with '" + comparison.symbol() + "' needs a literal",
                    fieldPath.text());
        }
        if (!comparison.takesLiteral()) {
            literal = null;
        }
    }

    /** Convenience factory for an equality filter. */
    public static ScopeFilter equalTo(String fieldPath, String literal) {
        return new ScopeFilter(PathExpression.parse(fieldPath), Comparison.EQUALS, literal);
    }

    /**
     * Parses the textual form, e.g. {@code code.coding.code = 'HS'},
     * {@code status in ('final','amended')} or {@code identifier.exists()}.
     *
     * @throws InvalidPathExpressionException if the text is not a filter
     */
    public static ScopeFilter parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidPathExpressionException("Scope filter must not be blank", text);
        }
        String trimmed = text.trim();
        Matcher unary = UNARY.matcher(trimmed);
        if (unary.matches()) {
            Comparison c = "exists".equals(unary.group(2)) ? Comparison.EXISTS : Comparison.NOT_EXISTS;
            return new ScopeFilter(PathExpression.parse(unary.group(1)), c, null);
        }
        Matcher binary = BINARY.matcher(trimmed);
        if (!binary.matches()) {
            throw new InvalidPathExpressionException("Scope filter '" + trimmed + "' is not a comparison", trimmed);
        }
        Comparison c = Comparison.fromSymbol(binary.group(2));
        String rawLiteral = binary.group(3).trim();
        String literal = c == Comparison.IN ? parseList(rawLiteral, trimmed) : unquote(rawLiteral);
        return new ScopeFilter(PathExpression.parse(binary.group(1)), c, literal);
    }

    /** The literal values of an {@link Comparison#IN} filter, or the single literal. */
    public List<String> literalValues() {
        if (literal == null) {
            return List.of();
        }
        if (comparison != Comparison.IN) {
            return List.of(literal);
        }
        return Arrays.stream(literal.split(",")).map(String::trim).toList();
    }

    /** Deterministic text used to compare scopes across rules. */
    public String stableKey() {
        return fieldPath.text() + comparison.symbol() + (literal == null ? "" : literal);
    }

    @Override
    public String toString() {
        return switch (comparison) {
            case EXISTS -> fieldPath + ".exists()";
            case NOT_EXISTS -> fieldPath + ".empty()";
            default -> fieldPath + " " + comparison.symbol() + " '" + literal + "'";
        };
    }

    private static String parseList(String raw, String whole) {
        String body = raw;
        if (body.startsWith("(") && body.endsWith(")")) {
            body = body.substring(1, body.length() - 1);
        }
        StringBuilder joined = new StringBuilder();
        for (String item : body.split(",")) {
            String value = unquote(item.trim());
            if (value.isEmpty()) {
                throw new InvalidPathExpressionException("Scope filter '" + whole + "' has an empty list item", whole);
            }
            if (joined.length() > 0) {
                joined.append(',');
            }
            joined.append(value);
        }
        return joined.toString();
    }

    private static String unquote(String raw) {
        if (raw.length() >= 2 && raw.startsWith("'") && raw.endsWith("'")) {
            return raw.substring(1, raw.length() - 1);
        }
        return raw;
    }
}
