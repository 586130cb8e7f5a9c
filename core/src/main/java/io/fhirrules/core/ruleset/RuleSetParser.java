package io.fhirrules.core.ruleset;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fhirrules.core.error.InvalidPathExpressionException;
import io.fhirrules.core.error.RuleConfigurationException;
import io.fhirrules.core.error.RuleSetParseException;
import io.fhirrules.core.model.AnswerConstraint;
import io.fhirrules.core.model.InstanceScope;
import io.fhirrules.core.model.ResourceRequirement;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.model.RuleType;
import io.fhirrules.core.model.ScopeFilter;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.path.PathExpression;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses YAML rule-set files into {@link RuleSet} instances.
 *
 * <pre>
 * ruleset: patient-core
 * version: "1.0.0"
 * rules:
 *   - id: r1
 *     type: Required
 *     resourceType: Patient
 *     fieldPath: birthDate
 *     severity: error
 *     scope: all          # all | first | { filter: "code.coding.code = 'HS'" }
 *     params: {}
 * </pre>
 *
 * <p>
 * Unknown keys are rejected at every level. Any construction failure of a rule
 * surfaces as a {@link RuleSetParseException} carrying the source and the rule
 * id (or index when the id is missing).
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class RuleSetParser {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetParser.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private static final Set<String> ROOT_KEYS = Set.of("ruleset", "version", "description", "rules");
    private static final Set<String> RULE_KEYS = Set.of(
            "id", "type", "resourceType", "fieldPath", "severity", "scope", "params", "errorCode", "hint", "enabled");
    private static final Set<String> REQUIREMENT_KEYS = Set.of("resourceType", "min", "max", "where");

    private RuleSetParser() {}

    /**
     * Parses the YAML file at the given path.
     *
     * @throws RuleSetParseException if the file cannot be read or is invalid
     */
    public static RuleSet parse(Path path) {
        String source = path.toString();
        try {
            return parse(Files.readString(path), source);
        } catch (IOException e) {
            throw new RuleSetParseException("Failed to read rule set: " + e.getMessage(), e, null, source);
        }
    }

    /**
     * Parses YAML content.
     *
     * @param yaml   the YAML text
     * @param source label used in error messages, e.g. a file name
     * @throws RuleSetParseException if the content is invalid
     */
    public static RuleSet parse(String yaml, String source) {
        JsonNode root = readYaml(yaml, source);
        if (root == null || !root.isObject()) {
            throw new RuleSetParseException("Rule set must be a YAML mapping", null, source);
        }
        rejectUnknownKeys(root, ROOT_KEYS, "rule set", null, source);

        String ruleSetId = requireString(root, "ruleset", null, source);
        String version = optionalString(root, "version");

        JsonNode rulesNode = root.get("rules");
        if (rulesNode == null || !rulesNode.isArray()) {
            throw new RuleSetParseException(
                    "Rule set '" + ruleSetId + "' must contain a 'rules' array", null, source);
        }

        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < rulesNode.size(); i++) {
            rules.add(parseRule(rulesNode.get(i), i, source));
        }

        try {
            RuleSet ruleSet = new RuleSet(ruleSetId, version, rules);
            LOG.info("Loaded rule set '{}' version {} with {} rule(s) from {}", ruleSetId, version, rules.size(), source);
            return ruleSet;
        } catch (RuleConfigurationException e) {
            throw new RuleSetParseException(e.getMessage(), e, e.ruleId(), source);
        }
    }

    // --- Rules ---

    private static Rule parseRule(JsonNode node, int index, String source) {
        String label = "rules[" + index + "]";
        if (node == null || !node.isObject()) {
            throw new RuleSetParseException(label + " must be a mapping", null, source);
        }
        String id = optionalString(node, "id");
        String ruleLabel = id != null ? id : label;
        rejectUnknownKeys(node, RULE_KEYS, "rule", ruleLabel, source);

        try {
            RuleType type = RuleType.fromWireName(requireString(node, "type", ruleLabel, source));
            JsonNode params = node.get("params");
            if (params != null && !params.isNull() && !params.isObject()) {
                throw new RuleSetParseException(ruleLabel + ": 'params' must be a mapping", ruleLabel, source);
            }
            String severity = optionalString(node, "severity");
            JsonNode enabled = node.get("enabled");

            return Rule.builder()
                    .id(id)
                    .resourceType(optionalString(node, "resourceType"))
                    .fieldPath(optionalString(node, "fieldPath"))
                    .scope(parseScope(node.get("scope"), ruleLabel, source))
                    .params(parseParams(type, params, ruleLabel, source))
                    .severity(severity == null ? Severity.ERROR : Severity.fromWireName(severity))
                    .errorCode(optionalString(node, "errorCode"))
                    .hint(optionalString(node, "hint"))
                    .enabled(enabled == null || enabled.asBoolean(true))
                    .build();
        } catch (RuleConfigurationException | InvalidPathExpressionException | IllegalArgumentException e) {
            throw new RuleSetParseException(ruleLabel + ": " + e.getMessage(), e, ruleLabel, source);
        }
    }

    private static InstanceScope parseScope(JsonNode node, String ruleLabel, String source) {
        if (node == null || node.isNull()) {
            return InstanceScope.ALL;
        }
        if (node.isTextual()) {
            return switch (node.asText().trim().toLowerCase()) {
                case "all" -> InstanceScope.ALL;
                case "first" -> InstanceScope.FIRST;
                default -> throw new RuleSetParseException(
                        ruleLabel + ": unknown scope '" + node.asText() + "', expected all, first or {filter: ...}",
                        ruleLabel,
                        source);
            };
        }
        if (node.isObject()) {
            rejectUnknownKeys(node, Set.of("filter"), "scope", ruleLabel, source);
            return InstanceScope.filtered(ScopeFilter.parse(requireString(node, "filter", ruleLabel, source)));
        }
        throw new RuleSetParseException(ruleLabel + ": 'scope' must be a string or a mapping", ruleLabel, source);
    }

    private static RuleParams parseParams(RuleType type, JsonNode params, String ruleLabel, String source) {
        JsonNode p = params == null || params.isNull() ? YAML_MAPPER.createObjectNode() : params;
        return switch (type) {
            case REQUIRED -> {
                rejectUnknownKeys(p, Set.of(), "Required params", ruleLabel, source);
                yield new RuleParams.RequiredParams();
            }
            case FIXED_VALUE -> {
                rejectUnknownKeys(p, Set.of("value"), "FixedValue params", ruleLabel, source);
                yield new RuleParams.FixedValueParams(p.get("value"));
            }
            case ALLOWED_VALUES -> {
                rejectUnknownKeys(p, Set.of("values"), "AllowedValues params", ruleLabel, source);
                yield new RuleParams.AllowedValuesParams(stringList(p.get("values"), "values", ruleLabel, source));
            }
            case REGEX -> {
                rejectUnknownKeys(p, Set.of("pattern", "negate", "caseInsensitive"), "Regex params", ruleLabel, source);
                yield new RuleParams.RegexParams(
                        optionalString(p, "pattern"),
                        p.path("negate").asBoolean(false),
                        p.path("caseInsensitive").asBoolean(false));
            }
            case ARRAY_LENGTH -> {
                rejectUnknownKeys(p, Set.of("min", "max"), "ArrayLength params", ruleLabel, source);
                yield new RuleParams.ArrayLengthParams(optionalInt(p, "min"), optionalInt(p, "max"));
            }
            case CODE_SYSTEM -> {
                rejectUnknownKeys(p, Set.of("system", "codes"), "CodeSystem params", ruleLabel, source);
                yield new RuleParams.CodeSystemParams(
                        optionalString(p, "system"), stringList(p.get("codes"), "codes", ruleLabel, source));
            }
            case CUSTOM_EXPRESSION -> {
                rejectUnknownKeys(p, Set.of("expression"), "CustomExpression params", ruleLabel, source);
                yield new RuleParams.CustomExpressionParams(optionalString(p, "expression"));
            }
            case RESOURCE_COMPOSITION -> {
                rejectUnknownKeys(
                        p, Set.of("requirements", "rejectUndeclared"), "ResourceComposition params", ruleLabel, source);
                yield new RuleParams.ResourceCompositionParams(
                        parseRequirements(p.get("requirements"), ruleLabel, source),
                        p.path("rejectUndeclared").asBoolean(false));
            }
            case QUESTION_ANSWER -> {
                rejectUnknownKeys(
                        p,
                        Set.of("questionSetId", "iterationPath", "questionPath", "answerPath", "constraint"),
                        "QuestionAnswer params",
                        ruleLabel,
                        source);
                String constraint = optionalString(p, "constraint");
                yield new RuleParams.QuestionAnswerParams(
                        optionalString(p, "questionSetId"),
                        optionalPath(p, "iterationPath"),
                        optionalPath(p, "questionPath"),
                        optionalPath(p, "answerPath"),
                        constraint == null ? null : AnswerConstraint.fromWireName(constraint));
            }
        };
    }

    private static List<ResourceRequirement> parseRequirements(JsonNode node, String ruleLabel, String source) {
        if (node == null || !node.isArray()) {
            throw new RuleSetParseException(
                    ruleLabel + ": ResourceComposition 'requirements' must be a list", ruleLabel, source);
        }
        List<ResourceRequirement> requirements = new ArrayList<>();
        for (JsonNode item : node) {
            rejectUnknownKeys(item, REQUIREMENT_KEYS, "requirement", ruleLabel, source);
            List<ScopeFilter> where = new ArrayList<>();
            for (String filter : stringList(item.get("where"), "where", ruleLabel, source)) {
                where.add(ScopeFilter.parse(filter));
            }
            Integer min = optionalInt(item, "min");
            requirements.add(new ResourceRequirement(
                    optionalString(item, "resourceType"), min == null ? 0 : min, optionalInt(item, "max"), where));
        }
        return requirements;
    }

    // --- YAML helpers ---

    private static JsonNode readYaml(String yaml, String source) {
        try {
            return YAML_MAPPER.readTree(yaml);
        } catch (JsonProcessingException e) {
            throw new RuleSetParseException("Failed to parse rule set YAML: " + e.getOriginalMessage(), e, null, source);
        }
    }

    static void rejectUnknownKeys(JsonNode node, Set<String> known, String what, String ruleLabel, String source) {
        if (node == null || !node.isObject()) {
            throw new RuleSetParseException(
                    (ruleLabel == null ? "" : ruleLabel + ": ") + what + " must be a mapping", ruleLabel, source);
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!known.contains(name)) {
                throw new RuleSetParseException(
                        String.format(
                                "%sunknown key '%s' in %s; allowed: %s",
                                ruleLabel == null ? "" : ruleLabel + ": ", name, what, known.stream().sorted().toList()),
                        ruleLabel,
                        source);
            }
        }
    }

    static String requireString(JsonNode node, String field, String ruleLabel, String source) {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull() || value.asText().isBlank()) {
            throw new RuleSetParseException(
                    (ruleLabel == null ? "" : ruleLabel + ": ") + "missing required field '" + field + "'",
                    ruleLabel,
                    source);
        }
        return value.asText();
    }

    static String optionalString(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Integer optionalInt(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new RuleConfigurationException("'" + field + "' must be an integer, got '" + value.asText() + "'", null);
        }
        return value.intValue();
    }

    private static PathExpression optionalPath(JsonNode node, String field) {
        String text = optionalString(node, field);
        return text == null ? null : PathExpression.parse(text);
    }

    static List<String> stringList(JsonNode node, String field, String ruleLabel, String source) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new RuleSetParseException(
                    (ruleLabel == null ? "" : ruleLabel + ": ") + "'" + field + "' must be a list", ruleLabel, source);
        }
        List<String> values = new ArrayList<>();
        for (JsonNode item : node) {
            values.add(item.asText());
        }
        return values;
    }
}
