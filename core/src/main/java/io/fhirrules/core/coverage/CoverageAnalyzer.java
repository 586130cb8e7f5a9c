package io.fhirrules.core.coverage;

import io.fhirrules.core.model.CoverageNode;
import io.fhirrules.core.model.CoverageReport;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleSuggestion;
import io.fhirrules.core.model.SchemaNode;
import io.fhirrules.core.path.PathMatch;
import io.fhirrules.core.path.PathMatcher;
import io.fhirrules.core.path.PathNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes which schema paths of one resource type are covered by authored
 * rules, have a pending suggestion, or have neither.
 *
 * <p>
 * Rules are tried first; suggestions only for paths no rule covers. Within
 * each, the match priority of {@link PathMatcher#matchBestRule} applies. The
 * result is advisory and never gates validation.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class CoverageAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(CoverageAnalyzer.class);

    private CoverageAnalyzer() {}

    /**
     * @param schemaTree  schema tree whose root name is the resource type
     * @param rules       rules in authoring order; rules for other resource
     *                    types and record-scoped rules are ignored
     * @param suggestions suggestion candidates, may be empty
     * @return one node per flattened schema path, in schema order
     */
    public static CoverageReport analyze(SchemaNode schemaTree, List<Rule> rules, List<RuleSuggestion> suggestions) {
        String resourceType = schemaTree.name();
        List<NormalizedRule> candidates = new ArrayList<>();
        for (Rule rule : rules) {
            if (rule.fieldPath() == null || !resourceType.equals(rule.resourceType())) {
                continue;
            }
            candidates.add(new NormalizedRule(rule, PathNormalizer.normalize(rule.fieldPathText(), resourceType)));
        }
        List<NormalizedSuggestion> suggested = new ArrayList<>();
        for (RuleSuggestion suggestion : suggestions == null ? List.<RuleSuggestion>of() : suggestions) {
            suggested.add(new NormalizedSuggestion(suggestion, PathNormalizer.normalize(suggestion.path(), resourceType)));
        }

        List<CoverageNode> nodes = new ArrayList<>();
        for (String path : SchemaFlattener.flatten(schemaTree)) {
            nodes.add(nodeFor(path, candidates, suggested));
        }
        CoverageReport report = CoverageReport.of(resourceType, nodes);
        LOG.debug("Coverage for {}: {}/{} covered", resourceType, report.summary().covered(), report.summary().total());
        return report;
    }

    private static CoverageNode nodeFor(
            String path, List<NormalizedRule> rules, List<NormalizedSuggestion> suggestions) {
        Optional<PathMatch<NormalizedRule>> byRule = PathMatcher.matchBestRule(rules, NormalizedRule::path, path);
        if (byRule.isPresent()) {
            NormalizedRule winner = byRule.get().candidate();
            return CoverageNode.covered(path, byRule.get().matchType(), winner.rule().id(), winner.path());
        }
        Optional<PathMatch<NormalizedSuggestion>> bySuggestion =
                PathMatcher.matchBestRule(suggestions, NormalizedSuggestion::path, path);
        if (bySuggestion.isPresent()) {
            return CoverageNode.suggested(
                    path, bySuggestion.get().matchType(), bySuggestion.get().candidate().suggestion().id());
        }
        return CoverageNode.uncovered(path);
    }

    private record NormalizedRule(Rule rule, String path) {}

    private record NormalizedSuggestion(RuleSuggestion suggestion, String path) {}
}
