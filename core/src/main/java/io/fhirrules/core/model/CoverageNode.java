package io.fhirrules.core.model;

import io.fhirrules.core.path.MatchType;
import java.util.Objects;

/**
 * Coverage of one schema-relative path.
 *
 * @param path         the schema path
 * @param status       covered, suggested or uncovered
 * @param matchType    strength of the covering match, {@code null} when
 *                     uncovered
 * @param ruleId       covering rule, set only when covered
 * @param rulePath     normalised path of the covering rule
 * @param suggestionId matching suggestion, set only when suggested
 * @param reason       short explanation
 */
public record CoverageNode(
        String path,
        CoverageStatus status,
        MatchType matchType,
        String ruleId,
        String rulePath,
        String suggestionId,
        String reason) {

    public CoverageNode {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
    }

    public static CoverageNode covered(String path, MatchType matchType, String ruleId, String rulePath) {
        return new CoverageNode(
                path, CoverageStatus.COVERED, matchType, ruleId, rulePath, null,
                "Covered by rule '" + ruleId + "' (" + matchType.wireName() + " match)");
    }

    public static CoverageNode suggested(String path, MatchType matchType, String suggestionId) {
        return new CoverageNode(
                path, CoverageStatus.SUGGESTED, matchType, null, null, suggestionId,
                "Suggestion '" + suggestionId + "' available (" + matchType.wireName() + " match)");
    }

    public static CoverageNode uncovered(String path) {
        return new CoverageNode(path, CoverageStatus.UNCOVERED, null, null, null, null, "No rule or suggestion");
    }
}
