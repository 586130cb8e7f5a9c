package io.fhirrules.core.ruleset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fhirrules.core.error.RuleSetParseException;
import io.fhirrules.core.model.AnswerType;
import io.fhirrules.core.model.Question;
import io.fhirrules.core.model.QuestionSet;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Parses YAML question-set files.
 *
 * <pre>
 * questionSet: vitals
 * questions:
 *   - id: systolic
 *     system: http://loinc.org
 *     code: 8480-6
 *     answerType: quantity
 *     min: 0
 *     max: 300
 * </pre>
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class QuestionSetParser {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> ROOT_KEYS = Set.of("questionSet", "description", "questions");
    private static final Set<String> QUESTION_KEYS = Set.of(
            "id", "system", "code", "display", "answerType", "min", "max", "allowedCodes", "answerSystem",
            "multipleAllowed");

    private QuestionSetParser() {}

    public static QuestionSet parse(Path path) {
        String source = path.toString();
        try {
            return parse(Files.readString(path), source);
        } catch (IOException e) {
            throw new RuleSetParseException("Failed to read question set: " + e.getMessage(), e, null, source);
        }
    }

    public static QuestionSet parse(String yaml, String source) {
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new RuleSetParseException(
                    "Failed to parse question set YAML: " + e.getOriginalMessage(), e, null, source);
        }
        RuleSetParser.rejectUnknownKeys(root, ROOT_KEYS, "question set", null, source);
        String id = RuleSetParser.requireString(root, "questionSet", null, source);

        JsonNode questionsNode = root.get("questions");
        if (questionsNode == null || !questionsNode.isArray() || questionsNode.isEmpty()) {
            throw new RuleSetParseException(
                    "Question set '" + id + "' must contain a non-empty 'questions' array", null, source);
        }

        List<Question> questions = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < questionsNode.size(); i++) {
            Question question = parseQuestion(questionsNode.get(i), "questions[" + i + "]", source);
            if (!seen.add(question.id())) {
                throw new RuleSetParseException(
                        "Question set '" + id + "' declares question '" + question.id() + "' twice", null, source);
            }
            questions.add(question);
        }
        return new QuestionSet(id, questions);
    }

    private static Question parseQuestion(JsonNode node, String label, String source) {
        RuleSetParser.rejectUnknownKeys(node, QUESTION_KEYS, "question", label, source);
        String answerType = RuleSetParser.requireString(node, "answerType", label, source);
        AnswerType type;
        try {
            type = AnswerType.valueOf(answerType.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new RuleSetParseException(label + ": unknown answerType '" + answerType + "'", e, null, source);
        }
        return new Question(
                RuleSetParser.requireString(node, "id", label, source),
                RuleSetParser.optionalString(node, "system"),
                RuleSetParser.requireString(node, "code", label, source),
                RuleSetParser.optionalString(node, "display"),
                type,
                decimal(node, "min", label, source),
                decimal(node, "max", label, source),
                RuleSetParser.stringList(node.get("allowedCodes"), "allowedCodes", label, source),
                RuleSetParser.optionalString(node, "answerSystem"),
                node.path("multipleAllowed").asBoolean(false));
    }

    private static BigDecimal decimal(JsonNode node, String field, String label, String source) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isNumber()) {
            throw new RuleSetParseException(label + ": '" + field + "' must be a number", null, source);
        }
        return value.decimalValue();
    }
}
