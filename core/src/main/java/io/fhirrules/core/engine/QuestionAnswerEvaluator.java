package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.fhirrules.core.model.AnswerType;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Question;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.Severity;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks question/answer pairs inside one location against a
 * {@link QuestionSet}.
 *
 * <p>
 * Every node at the iteration path is one question/answer pair. The question
 * Coding at the question path identifies the {@link Question}; the value at
 * the answer path is checked against the rule's constraint. A pair whose
 * Coding is not in the question set yields a {@code QUESTION_NOT_FOUND}
 * warning. A pair without any question Coding is not a question and is
 * skipped.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class QuestionAnswerEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(QuestionAnswerEvaluator.class);

    private QuestionAnswerEvaluator() {}

    static List<Finding> evaluate(
            Rule rule, RuleParams.QuestionAnswerParams params, QuestionSet questionSet, Location loc) {
        List<Finding> findings = new ArrayList<>();
        for (PathValue pair : RecordNavigator.select(loc.resource(), params.iterationPath(), loc.path())) {
            List<PathValue> codings = FieldRuleChecks.codingsAt(
                    RecordNavigator.select(pair.value(), params.questionPath(), pair.path()));
            if (codings.isEmpty()) {
                LOG.debug("No question coding at {}.{}; skipped", pair.path(), params.questionPath());
                continue;
            }
            Optional<Question> question = findQuestion(questionSet, codings);
            if (question.isEmpty()) {
                JsonNode first = codings.get(0).value();
                findings.add(Findings.business(
                        rule,
                        Severity.WARNING,
                        ErrorCodes.QUESTION_NOT_FOUND,
                        loc.resourceType(),
                        codings.get(0).path(),
                        "Question " + first.path("system").asText("") + "|" + first.path("code").asText("")
                                + " is not defined in question set '" + questionSet.id() + "'",
                        Map.of("questionSetId", questionSet.id(), "questionCode", first.path("code").asText(""))));
                continue;
            }
            List<PathValue> answers = RecordNavigator.select(pair.value(), params.answerPath(), pair.path()).stream()
                    .filter(a -> !JsonNodeUtils.isBlank(a.value()))
                    .toList();
            check(rule, params, question.get(), pair, answers, loc).ifPresent(findings::add);
        }
        return findings;
    }

    private static Optional<Finding> check(
            Rule rule,
            RuleParams.QuestionAnswerParams params,
            Question question,
            PathValue pair,
            List<PathValue> answers,
            Location loc) {
        String answerPath = pair.path() + "." + params.answerPath();
        switch (params.constraint()) {
            case REQUIRED -> {
                if (answers.isEmpty()) {
                    return fail(rule, question, loc, answerPath, "Question '" + label(question) + "' has no answer",
                            Map.of());
                }
            }
            case TYPE -> {
                for (PathValue a : answers) {
                    if (!hasType(a.value(), question.answerType())) {
                        return fail(rule, question, loc, a.path(),
                                "Answer to '" + label(question) + "' must be of type " + question.answerType(),
                                Map.of("expectedType", question.answerType().name()));
                    }
                }
            }
            case RANGE -> {
                for (PathValue a : answers) {
                    BigDecimal number = JsonNodeUtils.numberOf(a.value());
                    if (number == null) {
                        continue;
                    }
                    boolean below = question.min() != null && number.compareTo(question.min()) < 0;
                    boolean above = question.max() != null && number.compareTo(question.max()) > 0;
                    if (below || above) {
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("actual", number);
                        if (question.min() != null) {
                            details.put("min", question.min());
                        }
                        if (question.max() != null) {
                            details.put("max", question.max());
                        }
                        return fail(rule, question, loc, a.path(),
                                "Answer " + number.toPlainString() + " to '" + label(question) + "' is out of range",
                                details);
                    }
                }
            }
            case VALUESET -> {
                for (PathValue a : answers) {
                    for (PathValue coding : answerCodings(a)) {
                        String system = coding.value().path("system").asText(null);
                        String code = coding.value().path("code").asText(null);
                        boolean systemOk = question.answerSystem() == null || question.answerSystem().equals(system);
                        boolean codeOk = question.allowedCodes().isEmpty()
                                || (code != null && question.allowedCodes().contains(code));
                        if (!systemOk || !codeOk) {
                            return fail(rule, question, loc, coding.path(),
                                    "Answer code '" + code + "' to '" + label(question) + "' is not in the allowed set",
                                    Map.of("actualCode", code == null ? "" : code, "allowedCodes",
                                            question.allowedCodes()));
                        }
                    }
                }
            }
            case SINGLE_ANSWER -> {
                if (!question.multipleAllowed() && answers.size() > 1) {
                    return fail(rule, question, loc, answerPath,
                            "Question '" + label(question) + "' allows one answer, found " + answers.size(),
                            Map.of("count", answers.size()));
                }
            }
        }
        return Optional.empty();
    }

    private static Optional<Question> findQuestion(QuestionSet questionSet, List<PathValue> codings) {
        for (PathValue coding : codings) {
            Optional<Question> q = questionSet.find(
                    coding.value().path("system").asText(null), coding.value().path("code").asText(null));
            if (q.isPresent()) {
                return q;
            }
        }
        return Optional.empty();
    }

    private static List<PathValue> answerCodings(PathValue answer) {
        if (answer.value().isTextual()) {
            return List.of(new PathValue(answer.path(), codingOf(answer.value().asText())));
        }
        return FieldRuleChecks.codingsAt(List.of(answer));
    }

    private static JsonNode codingOf(String code) {
        return JsonNodeFactory.instance.objectNode().put("code", code);
    }

    static boolean hasType(JsonNode value, AnswerType type) {
        return switch (type) {
            case CODE -> value.isObject() && (value.path("coding").isArray() || value.has("code"));
            case QUANTITY -> value.isObject() && value.path("value").isNumber();
            case INTEGER -> value.isIntegralNumber();
            case DECIMAL -> value.isNumber();
            case STRING -> value.isTextual();
            case BOOLEAN -> value.isBoolean();
        };
    }

    private static Optional<Finding> fail(
            Rule rule, Question question, Location loc, String path, String message, Map<String, Object> extra) {
        Map<String, Object> details = new LinkedHashMap<>(extra);
        details.put("questionId", question.id());
        details.put("constraint", ((RuleParams.QuestionAnswerParams) rule.params()).constraint().wireName());
        return Optional.of(Findings.business(rule, loc, path, message, details));
    }

    private static String label(Question question) {
        return question.display() != null ? question.display() : question.code();
    }
}
