package io.fhirrules.core.governance;

import io.fhirrules.core.model.ReviewIssue;
import io.fhirrules.core.model.ReviewResult;
import io.fhirrules.core.model.ReviewStatus;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleType;
import io.fhirrules.core.path.PathExpression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Governance review of a candidate rule set. Classifies each rule as
 * {@link ReviewStatus#OK}, {@link ReviewStatus#WARNING} or
 * {@link ReviewStatus#BLOCKED} under a fixed policy.
 *
 * <p>
 * Blocking checks enforce the stored form of field paths: relative to the
 * resource, no index or wildcard marker, no filter clause or function, not
 * reaching into the bundle. They also block patterns on elements that are
 * never strings. Warning checks flag risky but legal rules, plus duplicate
 * and conflicting rules across the set.
 *
 * <p>
 * The review is a pure function of its input. Thread-safe and stateless.
 */
public final class RuleReviewEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleReviewEngine.class);

    /** Elements whose JSON value is never a string. */
    private static final Set<String> NON_STRING_ELEMENTS =
            Set.of("active", "period", "quantity", "address", "contact", "deceasedBoolean", "multipleBirthInteger");

    /** Elements that repeat in the base resources. */
    private static final Set<String> ARRAY_ELEMENTS = Set.of(
            "identifier", "telecom", "address", "name", "contact", "communication", "extension", "contained",
            "entry", "item", "component", "code", "coding", "note", "performer", "category", "given", "line");

    /** Complex elements a value comparison on the element itself rarely means. */
    private static final Set<String> COMPLEX_ELEMENTS = Set.of(
            "identifier", "name", "telecom", "address", "contact", "code", "coding", "extension", "meta", "text",
            "component", "category");

    private RuleReviewEngine() {}

    /**
     * Reviews rules in order.
     *
     * @param rules candidate rules in authoring order
     * @return one result per rule, in the same order
     */
    public static List<ReviewResult> review(List<Rule> rules) {
        // Indexed by position: ids are not guaranteed unique here.
        List<List<ReviewIssue>> issues = new ArrayList<>(rules.size());
        for (Rule rule : rules) {
            List<ReviewIssue> ruleIssues = new ArrayList<>();
            checkFieldPath(rule, ruleIssues);
            checkPatternOnNonString(rule, ruleIssues);
            checkSemanticStability(rule, ruleIssues);
            checkArrayLengthOnNonArray(rule, ruleIssues);
            checkBroadPath(rule, ruleIssues);
            checkGenericWildcard(rule, ruleIssues);
            checkFixedValueWithoutSystem(rule, ruleIssues);
            issues.add(ruleIssues);
        }
        checkDuplicates(rules, issues);
        checkErrorCodeConflicts(rules, issues);

        List<ReviewResult> results = new ArrayList<>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            ReviewResult result = ReviewResult.of(rule.id(), issues.get(i));
            if (result.status() == ReviewStatus.BLOCKED) {
                LOG.warn("Rule {} blocked: {}", rule.id(), result.issues().stream()
                        .filter(issue -> issue.severity() == ReviewStatus.BLOCKED)
                        .map(ReviewIssue::code)
                        .toList());
            }
            results.add(result);
        }
        return results;
    }

    /** Whether any result is blocked. */
    public static boolean anyBlocked(List<ReviewResult> results) {
        return results.stream().anyMatch(r -> r.status() == ReviewStatus.BLOCKED);
    }

    // ═══ Blocking checks ═══

    private static void checkFieldPath(Rule rule, List<ReviewIssue> issues) {
        PathExpression path = rule.fieldPath();
        if (path == null) {
            return;
        }
        String first = path.firstSegmentName();
        if (path.text().equals(rule.resourceType())) {
            issues.add(blocked(ReviewCodes.ROOT_LEVEL_PATH, rule, "path", path.text(),
                    "reason", "Path addresses the resource itself, not a field"));
        } else if ("Bundle".equals(first) || "entry".equals(first)) {
            issues.add(blocked(ReviewCodes.FIELD_PATH_BUNDLE_REFERENCE, rule, "path", path.text(),
                    "reason", "Field paths are resource-relative and must not reach into the bundle"));
        } else if (first.equals(rule.resourceType()) || Character.isUpperCase(first.charAt(0))) {
            issues.add(blocked(ReviewCodes.FIELD_PATH_RESOURCE_PREFIX, rule, "path", path.text(),
                    "prefix", first));
        }
        if (path.hasIndexMarker() || path.hasWildcard()) {
            issues.add(blocked(ReviewCodes.FIELD_PATH_INDEX_MARKER, rule, "path", path.text(),
                    "reason", "Instance selection belongs to the rule's scope, not its path"));
        }
        if (path.hasFilterClause()) {
            issues.add(blocked(ReviewCodes.FIELD_PATH_FILTER_CLAUSE, rule, "path", path.text(),
                    "reason", "Filters belong to a scope filter, not the field path"));
        }
        if (path.hasFunction()) {
            issues.add(blocked(ReviewCodes.FIELD_PATH_FUNCTION, rule, "path", path.text(),
                    "reason", "Functions are expressed by the rule type, not the field path"));
        }
    }

    private static void checkPatternOnNonString(Rule rule, List<ReviewIssue> issues) {
        if (rule.type() != RuleType.REGEX) {
            return;
        }
        for (PathExpression.Segment segment : rule.fieldPath().segments()) {
            if (NON_STRING_ELEMENTS.contains(segment.name())) {
                issues.add(blocked(ReviewCodes.PATTERN_ON_NON_STRING, rule, "path", rule.fieldPathText(),
                        "element", segment.name()));
                return;
            }
        }
    }

    // ═══ Warning checks ═══

    private static void checkSemanticStability(Rule rule, List<ReviewIssue> issues) {
        if (rule.type() == RuleType.QUESTION_ANSWER || rule.type() == RuleType.CUSTOM_EXPRESSION) {
            issues.add(warning(ReviewCodes.RULE_SEMANTIC_STABILITY_INFO, rule, "ruleType", rule.type().wireName(),
                    "reason", "Outcome depends on data beyond the field path; review carefully"));
        }
    }

    private static void checkArrayLengthOnNonArray(Rule rule, List<ReviewIssue> issues) {
        if (rule.type() != RuleType.ARRAY_LENGTH) {
            return;
        }
        boolean repeating = rule.fieldPath().segments().stream().anyMatch(s -> ARRAY_ELEMENTS.contains(s.name()));
        if (!repeating) {
            issues.add(warning(ReviewCodes.ARRAY_LENGTH_ON_NON_ARRAY, rule, "path", rule.fieldPathText(),
                    "reason", "Path does not contain a known repeating element"));
        }
    }

    private static void checkBroadPath(Rule rule, List<ReviewIssue> issues) {
        if (rule.type() != RuleType.FIXED_VALUE
                && rule.type() != RuleType.ALLOWED_VALUES
                && rule.type() != RuleType.REGEX) {
            return;
        }
        List<PathExpression.Segment> segments = rule.fieldPath().segments();
        if (segments.size() == 1 && COMPLEX_ELEMENTS.contains(segments.get(0).name())) {
            issues.add(warning(ReviewCodes.BROAD_PATH, rule, "path", rule.fieldPathText(),
                    "reason", "Value comparison on a complex element without navigating to a field"));
        }
    }

    private static void checkGenericWildcard(Rule rule, List<ReviewIssue> issues) {
        PathExpression path = rule.fieldPath();
        if (path != null && path.hasWildcard() && !path.hasFilterClause()) {
            issues.add(warning(ReviewCodes.GENERIC_WILDCARD, rule, "path", path.text(),
                    "reason", "Wildcard [*] without a filter may match too broadly"));
        }
    }

    private static void checkFixedValueWithoutSystem(Rule rule, List<ReviewIssue> issues) {
        if (rule.type() != RuleType.FIXED_VALUE) {
            return;
        }
        List<String> names = rule.fieldPath().segments().stream().map(PathExpression.Segment::name).toList();
        if ((names.contains("code") || names.contains("coding")) && !names.contains("system")) {
            issues.add(warning(ReviewCodes.FIXED_VALUE_WITHOUT_SYSTEM, rule, "path", rule.fieldPathText(),
                    "reason", "FixedValue on a code without a system constraint may be ambiguous"));
        }
    }

    // ═══ Rule-set checks ═══

    private static void checkDuplicates(List<Rule> rules, List<List<ReviewIssue>> issues) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            String key = rule.type().wireName() + "|" + rule.resourceType() + "|"
                    + (rule.fieldPath() == null ? "" : rule.fieldPathText()) + "|" + rule.scope().stableKey();
            String first = seen.putIfAbsent(key, rule.id());
            if (first != null) {
                issues.get(i).add(warning(ReviewCodes.DUPLICATE_RULE, rule, "duplicateOf", first,
                        "ruleType", rule.type().wireName()));
            }
        }
    }

    private static void checkErrorCodeConflicts(List<Rule> rules, List<List<ReviewIssue>> issues) {
        Map<String, Map<String, List<Integer>>> byPath = new LinkedHashMap<>();
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            if (rule.fieldPath() == null) {
                continue;
            }
            byPath.computeIfAbsent(rule.resourceType() + "." + rule.fieldPathText(), k -> new LinkedHashMap<>())
                    .computeIfAbsent(rule.errorCode(), k -> new ArrayList<>())
                    .add(i);
        }
        for (Map.Entry<String, Map<String, List<Integer>>> entry : byPath.entrySet()) {
            Map<String, List<Integer>> byCode = entry.getValue();
            if (byCode.size() < 2) {
                continue;
            }
            for (Map.Entry<String, List<Integer>> codeEntry : byCode.entrySet()) {
                Set<String> others = new TreeSet<>(byCode.keySet());
                others.remove(codeEntry.getKey());
                for (int index : codeEntry.getValue()) {
                    Rule rule = rules.get(index);
                    issues.get(index).add(warning(ReviewCodes.PATH_ERROR_CODE_CONFLICT, rule,
                            "path", rule.fieldPathText(),
                            "conflictingErrorCodes", String.join(", ", new LinkedHashSet<>(others))));
                }
            }
        }
    }

    // --- Issue factories ---

    private static ReviewIssue blocked(String code, Rule rule, String k1, Object v1, String k2, Object v2) {
        return new ReviewIssue(code, ReviewStatus.BLOCKED, rule.id(), facts(k1, v1, k2, v2));
    }

    private static ReviewIssue warning(String code, Rule rule, String k1, Object v1, String k2, Object v2) {
        return new ReviewIssue(code, ReviewStatus.WARNING, rule.id(), facts(k1, v1, k2, v2));
    }

    private static Map<String, Object> facts(String k1, Object v1, String k2, Object v2) {
        Map<String, Object> facts = new LinkedHashMap<>();
        facts.put(k1, v1);
        facts.put(k2, v2);
        return facts;
    }
}
