package io.fhirrules.core.path;

import java.util.regex.Pattern;

/**
 * Canonicalises path expressions so rule paths and schema or record paths can
 * be compared by string equality.
 *
 * <p>
 * The rewrite, in order:
 * <ol>
 * <li>trim surrounding whitespace;</li>
 * <li>strip a leading {@code ResourceType.} segment;</li>
 * <li>strip {@code .count()} and {@code .exists()};</li>
 * <li>collapse {@code a.where(p).b} to {@code a.b} and drop a trailing
 * {@code .where(p)};</li>
 * <li>drop concrete {@code [n]} indexes, keeping {@code [*]}.</li>
 * </ol>
 * The rewrite is idempotent: normalising a normalised path is a no-op.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PathNormalizer {

    private static final Pattern FUNCTION_SUFFIX = Pattern.compile("\\.(count|exists)\\(\\)");
    private static final String WHERE_OPEN = ".where(";
    private static final Pattern NUMERIC_INDEX = Pattern.compile("\\[\\d+]");

    private PathNormalizer() {}

    /**
     * Normalises a path without stripping a resource-type prefix.
     *
     * @param path the path, may be {@code null}
     * @return the normalised path, empty for {@code null} or blank input
     */
    public static String normalize(String path) {
        return normalize(path, null);
    }

    /**
     * Normalises a path relative to the given resource type.
     *
     * @param path         the path, may be {@code null}
     * @param resourceType the owning resource type whose prefix is stripped, or
     *                     {@code null} to keep any prefix
     * @return the normalised path, empty for {@code null} or blank input
     */
    public static String normalize(String path, String resourceType) {
        if (path == null || path.isBlank()) {
            return "";
        }
        String result = path.trim();

        if (resourceType != null && !resourceType.isBlank()) {
            String prefix = resourceType + ".";
            if (result.startsWith(prefix)) {
                result = result.substring(prefix.length());
            }
        }

        result = FUNCTION_SUFFIX.matcher(result).replaceAll("");
        result = stripWhereClauses(result);
        result = NUMERIC_INDEX.matcher(result).replaceAll("");
        return result;
    }

    /**
     * Removes each top-level {@code .where(...)} clause, matching its closing
     * parenthesis across nested calls and quoted literals. An unterminated
     * clause is left in place.
     */
    static String stripWhereClauses(String path) {
        StringBuilder out = new StringBuilder(path.length());
        boolean inQuote = false;
        int i = 0;
        while (i < path.length()) {
            char c = path.charAt(i);
            if (!inQuote && path.startsWith(WHERE_OPEN, i)) {
                int close = closingParen(path, i + WHERE_OPEN.length());
                if (close < 0) {
                    out.append(path, i, path.length());
                    break;
                }
                i = close + 1;
                continue;
            }
            if (c == '\'') {
                inQuote = !inQuote;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /** Index of the parenthesis closing a group whose body starts at {@code from}, or -1. */
    private static int closingParen(String path, int from) {
        int depth = 1;
        boolean inQuote = false;
        for (int i = from; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '\'') {
                inQuote = !inQuote;
            } else if (!inQuote && c == '(') {
                depth++;
            } else if (!inQuote && c == ')' && --depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /** Removes every {@code [*]} marker. */
    public static String stripWildcards(String path) {
        return path == null ? "" : path.replace("[*]", "");
    }
}
