package io.fhirrules.core.path;

import java.util.Objects;

/**
 * The winning candidate of {@link PathMatcher#matchBestRule} together with the
 * strength it matched at.
 *
 * @param candidate the matched rule or suggestion
 * @param matchType the strength of the match
 * @param <T>       candidate type
 */
public record PathMatch<T>(T candidate, MatchType matchType) {

    public PathMatch {
        Objects.requireNonNull(candidate, "candidate must not be null");
        Objects.requireNonNull(matchType, "matchType must not be null");
    }
}
