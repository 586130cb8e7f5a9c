package io.fhirrules.core.engine;

import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleEngineException;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.path.PathExpression;
import io.fhirrules.core.path.Predicate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes one typed rule against a record.
 *
 * <p>
 * Field-level rules run once per location resolved by
 * {@link InstanceScopeResolver}, each location yielding no finding (pass) or
 * one finding (fail) independently of the others. Resource-composition rules
 * run once against the whole record. Question-answer rules yield at most one
 * finding per question/answer pair.
 *
 * <p>
 * A field path that embeds a {@code where} clause or a function cannot be
 * navigated and fails the evaluation with
 * {@link InvalidPathExpressionException}. A leading resource-type segment is
 * tolerated and skipped.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RuleEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEvaluator.class);

    private RuleEvaluator() {}

    /** Evaluates a rule that needs no question sets. */
    public static List<Finding> evaluate(Rule rule, FhirRecord record) {
        return evaluate(rule, record, Map.of());
    }

    /**
     * Evaluates a rule.
     *
     * @param rule         the rule
     * @param record       the record under validation
     * @param questionSets question sets by id, used by question-answer rules
     * @return findings in document order; empty when the rule passes or is
     *         disabled
     * @throws InvalidPathExpressionException if the rule's path cannot be
     *                                        navigated
     */
    public static List<Finding> evaluate(Rule rule, FhirRecord record, Map<String, QuestionSet> questionSets) {
        if (!rule.enabled()) {
            LOG.debug("Rule {} is disabled; skipped", rule.id());
            return List.of();
        }
        RuleParams params = rule.params();
        return switch (rule.type()) {
            case REQUIRED -> perLocation(rule, record, (path, loc) -> FieldRuleChecks.required(rule, path, loc));
            case FIXED_VALUE -> perLocation(rule, record, (path, loc) ->
                    FieldRuleChecks.fixedValue(rule, (RuleParams.FixedValueParams) params, path, loc));
            case ALLOWED_VALUES -> perLocation(rule, record, (path, loc) ->
                    FieldRuleChecks.allowedValues(rule, (RuleParams.AllowedValuesParams) params, path, loc));
            case REGEX -> perLocation(rule, record, (path, loc) ->
                    FieldRuleChecks.regex(rule, (RuleParams.RegexParams) params, path, loc));
            case ARRAY_LENGTH -> perLocation(rule, record, (path, loc) ->
                    FieldRuleChecks.arrayLength(rule, (RuleParams.ArrayLengthParams) params, path, loc));
            case CODE_SYSTEM -> perLocation(rule, record, (path, loc) ->
                    FieldRuleChecks.codeSystem(rule, (RuleParams.CodeSystemParams) params, path, loc));
            case CUSTOM_EXPRESSION -> customExpression(rule, (RuleParams.CustomExpressionParams) params, record);
            case RESOURCE_COMPOSITION -> ResourceCompositionEvaluator.evaluate(
                    rule, (RuleParams.ResourceCompositionParams) params, record);
            case QUESTION_ANSWER -> questionAnswer(
                    rule, (RuleParams.QuestionAnswerParams) params, record, questionSets);
        };
    }

    @FunctionalInterface
    private interface LocationCheck {
        Optional<Finding> check(PathExpression path, Location location);
    }

    private static List<Finding> perLocation(Rule rule, FhirRecord record, LocationCheck check) {
        PathExpression path = navigationPath(rule);
        List<Finding> findings = new ArrayList<>();
        for (Location loc : InstanceScopeResolver.resolve(rule.scope(), rule.resourceType(), record)) {
            check.check(path, loc).ifPresent(findings::add);
        }
        return findings;
    }

    private static List<Finding> customExpression(
            Rule rule, RuleParams.CustomExpressionParams params, FhirRecord record) {
        Predicate predicate = params.predicate();
        return perLocation(rule, record, (path, loc) -> {
            if (PredicateEvaluator.test(predicate, loc.resource())) {
                return Optional.empty();
            }
            return Optional.of(Findings.business(
                    rule,
                    loc,
                    loc.pathOf(path.text()),
                    "Custom rule '" + rule.id() + "' is not satisfied",
                    Map.of("expression", params.expression())));
        });
    }

    private static List<Finding> questionAnswer(
            Rule rule,
            RuleParams.QuestionAnswerParams params,
            FhirRecord record,
            Map<String, QuestionSet> questionSets) {
        List<Location> locations = InstanceScopeResolver.resolve(rule.scope(), rule.resourceType(), record);
        if (locations.isEmpty()) {
            return List.of();
        }
        QuestionSet questionSet = questionSets.get(params.questionSetId());
        if (questionSet == null) {
            LOG.warn("Question set '{}' referenced by rule {} was not supplied", params.questionSetId(), rule.id());
            return List.of(Findings.business(
                    rule,
                    rule.severity(),
                    ErrorCodes.QUESTIONSET_DATA_MISSING,
                    rule.resourceType(),
                    rule.resourceType(),
                    "Question set '" + params.questionSetId() + "' is not available",
                    Map.of("questionSetId", params.questionSetId())));
        }
        List<Finding> findings = new ArrayList<>();
        for (Location loc : locations) {
            findings.addAll(QuestionAnswerEvaluator.evaluate(rule, params, questionSet, loc));
        }
        return findings;
    }

    /** The rule's field path with any leading resource-type segment removed. */
    static PathExpression navigationPath(Rule rule) {
        PathExpression path = rule.fieldPath();
        if (!path.isNavigable()) {
            throw new InvalidPathExpressionException(
                    "Rule '" + rule.id() + "' has field path '" + path + "' which cannot be navigated",
                    path.text(),
                    rule.id(),
                    RuleEngineException.Phase.EVALUATION);
        }
        String prefix = rule.resourceType() + ".";
        if (path.text().startsWith(prefix)) {
            return PathExpression.parse(path.text().substring(prefix.length()));
        }
        return path;
    }
}
