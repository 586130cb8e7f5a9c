package io.fhirrules.core.path;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides the match strength between a rule path and a target (schema or
 * resolved record) path. Callers pass both paths already normalised by
 * {@link PathNormalizer}.
 *
 * <p>
 * Priority everywhere is exact, then wildcard, then parent.
 * {@link #matchBestRule} applies it across an ordered list of candidates.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class PathMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(PathMatcher.class);

    private PathMatcher() {}

    /** Both paths are string-equal. */
    public static boolean isExactMatch(String rulePath, String targetPath) {
        return rulePath != null && rulePath.equals(targetPath);
    }

    /**
     * The rule path contains {@code [*]}, the target does not, and stripping
     * the markers from the rule yields the target. Asymmetric: a plain rule
     * never matches a wildcard target.
     */
    public static boolean isWildcardMatch(String rulePath, String targetPath) {
        if (rulePath == null || targetPath == null) {
            return false;
        }
        if (!rulePath.contains("[*]") || targetPath.contains("[*]")) {
            return false;
        }
        return PathNormalizer.stripWildcards(rulePath).equals(targetPath);
    }

    /** The target lies strictly below the rule path. */
    public static boolean isParentMatch(String rulePath, String targetPath) {
        if (rulePath == null || rulePath.isEmpty() || targetPath == null) {
            return false;
        }
        return targetPath.startsWith(rulePath + ".");
    }

    /**
     * Returns the strongest predicate satisfied by the pair, or empty.
     */
    public static Optional<MatchType> matchType(String rulePath, String targetPath) {
        if (isExactMatch(rulePath, targetPath)) {
            return Optional.of(MatchType.EXACT);
        }
        if (isWildcardMatch(rulePath, targetPath)) {
            return Optional.of(MatchType.WILDCARD);
        }
        if (isParentMatch(rulePath, targetPath)) {
            return Optional.of(MatchType.PARENT);
        }
        return Optional.empty();
    }

    /**
     * Selects the candidate that best covers {@code targetPath}.
     *
     * <p>
     * <b>Precondition:</b> {@code orderedCandidates} is in authoring order. The
     * list is scanned once per strength. An exact match anywhere in the list
     * beats a wildcard match earlier in the list, and within one strength the
     * first candidate in list order wins. Reordering the list can therefore
     * change the result.
     *
     * @param orderedCandidates candidates in authoring order
     * @param pathOf            extracts the normalised path of a candidate
     * @param targetPath        the normalised target path
     * @param <T>               candidate type
     * @return the winning candidate with its match strength, or empty
     */
    public static <T> Optional<PathMatch<T>> matchBestRule(
            List<T> orderedCandidates, Function<T, String> pathOf, String targetPath) {
        for (MatchType strength : MatchType.values()) {
            for (T candidate : orderedCandidates) {
                if (matches(strength, pathOf.apply(candidate), targetPath)) {
                    LOG.debug("Path '{}' matched at strength {}", targetPath, strength);
                    return Optional.of(new PathMatch<>(candidate, strength));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean matches(MatchType strength, String rulePath, String targetPath) {
        return switch (strength) {
            case EXACT -> isExactMatch(rulePath, targetPath);
            case WILDCARD -> isWildcardMatch(rulePath, targetPath);
            case PARENT -> isParentMatch(rulePath, targetPath);
        };
    }
}
