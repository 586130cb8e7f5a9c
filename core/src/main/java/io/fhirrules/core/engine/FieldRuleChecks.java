package io.fhirrules.core.engine;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.path.PathExpression;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Per-location checks of the value-level rule types. Each check returns empty
 * on pass or exactly one finding on failure. A failing finding points at the
 * first offending value.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class FieldRuleChecks {

    private FieldRuleChecks() {}

    static Optional<Finding> required(Rule rule, PathExpression path, Location loc) {
        List<PathValue> values = RecordNavigator.select(loc.resource(), path, loc.path());
        if (values.stream().anyMatch(v -> !JsonNodeUtils.isBlank(v.value()))) {
            return Optional.empty();
        }
        return Optional.of(Findings.business(
                rule,
                loc,
                loc.pathOf(path.text()),
                "Required field '" + path + "' is missing or empty",
                Map.of("fieldPath", path.text())));
    }

    static Optional<Finding> fixedValue(
            Rule rule, RuleParams.FixedValueParams params, PathExpression path, Location loc) {
        List<PathValue> offending = RecordNavigator.select(loc.resource(), path, loc.path()).stream()
                .filter(v -> !JsonNodeUtils.valueEquals(v.value(), params.value()))
                .toList();
        if (offending.isEmpty()) {
            return Optional.empty();
        }
        PathValue first = offending.get(0);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("expected", params.value().asText());
        details.put("actual", first.value().isValueNode() ? first.value().asText() : first.value().toString());
        details.put("offendingCount", offending.size());
        return Optional.of(Findings.business(
                rule,
                loc,
                first.path(),
                "Value of '" + path + "' must be '" + params.value().asText() + "'",
                details));
    }

    static Optional<Finding> allowedValues(
            Rule rule, RuleParams.AllowedValuesParams params, PathExpression path, Location loc) {
        for (PathValue v : RecordNavigator.select(loc.resource(), path, loc.path())) {
            String text = JsonNodeUtils.scalarText(v.value());
            if (text == null || text.isBlank() || params.values().contains(text)) {
                continue;
            }
            return Optional.of(Findings.business(
                    rule,
                    loc,
                    v.path(),
                    "Value '" + text + "' of '" + path + "' is not one of " + params.values(),
                    Map.of("actual", text, "allowed", params.values())));
        }
        return Optional.empty();
    }

    static Optional<Finding> regex(Rule rule, RuleParams.RegexParams params, PathExpression path, Location loc) {
        Pattern pattern = params.compiled();
        for (PathValue v : RecordNavigator.select(loc.resource(), path, loc.path())) {
            String text = JsonNodeUtils.scalarText(v.value());
            if (text == null || text.isBlank()) {
                continue;
            }
            boolean found = pattern.matcher(text).find();
            if (found == params.negate()) {
                String expectation = params.negate() ? "must not match" : "must match";
                return Optional.of(Findings.business(
                        rule,
                        loc,
                        v.path(),
                        "Value '" + text + "' of '" + path + "' " + expectation + " /" + params.pattern() + "/",
                        Map.of("actual", text, "pattern", params.pattern(), "negate", params.negate())));
            }
        }
        return Optional.empty();
    }

    static Optional<Finding> arrayLength(
            Rule rule, RuleParams.ArrayLengthParams params, PathExpression path, Location loc) {
        int count = RecordNavigator.select(loc.resource(), path, loc.path()).size();
        String violation = null;
        if (params.min() != null && count < params.min()) {
            violation = "min";
        } else if (params.max() != null && count > params.max()) {
            violation = "max";
        }
        if (violation == null) {
            return Optional.empty();
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("violation", violation);
        details.put("count", count);
        if (params.min() != null) {
            details.put("min", params.min());
        }
        if (params.max() != null) {
            details.put("max", params.max());
        }
        String bound = "min".equals(violation) ? "at least " + params.min() : "at most " + params.max();
        return Optional.of(Findings.business(
                rule,
                loc,
                loc.pathOf(path.text()),
                "'" + path + "' has " + count + " item(s), expected " + bound,
                details));
    }

    static Optional<Finding> codeSystem(
            Rule rule, RuleParams.CodeSystemParams params, PathExpression path, Location loc) {
        for (PathValue coding : codingsAt(RecordNavigator.select(loc.resource(), path, loc.path()))) {
            String system = coding.value().path("system").asText(null);
            String code = coding.value().path("code").asText(null);
            if (!params.system().equals(system)) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("violation", "system");
                details.put("expectedSystem", params.system());
                details.put("actualSystem", system == null ? "" : system);
                return Optional.of(Findings.business(
                        rule,
                        loc,
                        coding.path() + ".system",
                        "Coding at '" + path + "' must use system " + params.system(),
                        details));
            }
            if (!params.codes().isEmpty() && (code == null || !params.codes().contains(code))) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("violation", "code");
                details.put("actualCode", code == null ? "" : code);
                details.put("allowedCodes", params.codes());
                return Optional.of(Findings.business(
                        rule,
                        loc,
                        coding.path() + ".code",
                        "Code '" + code + "' at '" + path + "' is not allowed in " + params.system(),
                        details));
            }
        }
        return Optional.empty();
    }

    /** Flattens Coding objects, directly selected or under a CodeableConcept's {@code coding}. */
    static List<PathValue> codingsAt(List<PathValue> values) {
        List<PathValue> codings = new ArrayList<>();
        for (PathValue v : values) {
            JsonNode node = v.value();
            if (node.path("coding").isArray()) {
                JsonNode array = node.get("coding");
                for (int i = 0; i < array.size(); i++) {
                    codings.add(new PathValue(v.path() + ".coding[" + i + "]", array.get(i)));
                }
            } else if (node.isObject() && (node.has("system") || node.has("code"))) {
                codings.add(v);
            }
        }
        return codings;
    }
}
