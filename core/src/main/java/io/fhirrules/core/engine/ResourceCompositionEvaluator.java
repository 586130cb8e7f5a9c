package io.fhirrules.core.engine;

import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.ResourceRequirement;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleParams;
import io.fhirrules.core.model.ScopeFilter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a resource-composition rule once against the whole record.
 *
 * <p>
 * Each requirement counts the instances of its resource type that satisfy all
 * of its filters and fails when the count is outside {@code [min, max]}. With
 * {@code rejectUndeclared}, every instance of a type no requirement mentions
 * fails on its own.
 *
 * <p>
 * Thread-safe and stateless.
 */
final class ResourceCompositionEvaluator {

    private ResourceCompositionEvaluator() {}

    static List<Finding> evaluate(Rule rule, RuleParams.ResourceCompositionParams params, FhirRecord record) {
        List<Finding> findings = new ArrayList<>();
        for (ResourceRequirement requirement : params.requirements()) {
            long count = record.instancesOf(requirement.resourceType()).stream()
                    .filter(l -> satisfiesAll(requirement.where(), l))
                    .count();
            String violation = null;
            if (count < requirement.min()) {
                violation = "min";
            } else if (requirement.max() != null && count > requirement.max()) {
                violation = "max";
            }
            if (violation != null) {
                findings.add(Findings.business(
                        rule,
                        rule.severity(),
                        rule.errorCode(),
                        requirement.resourceType(),
                        record.rootType(),
                        describe(requirement, count),
                        details(requirement, count, violation)));
            }
        }
        if (params.rejectUndeclared()) {
            for (Location entry : record.entries()) {
                if (!params.declares(entry.resourceType())) {
                    findings.add(Findings.business(
                            rule,
                            entry,
                            entry.path(),
                            "Resource type " + entry.resourceType() + " is not declared for this record",
                            Map.of("resourceType", entry.resourceType(), "violation", "undeclared")));
                }
            }
        }
        return findings;
    }

    private static boolean satisfiesAll(List<ScopeFilter> filters, Location location) {
        return filters.stream().allMatch(f -> PredicateEvaluator.matches(f, location.resource()));
    }

    private static String describe(ResourceRequirement requirement, long count) {
        String range = requirement.max() == null
                ? "at least " + requirement.min()
                : requirement.min() == requirement.max()
                        ? "exactly " + requirement.min()
                        : "between " + requirement.min() + " and " + requirement.max();
        String filtered = requirement.where().isEmpty() ? "" : " matching " + requirement.where();
        return "Expected " + range + " " + requirement.resourceType() + filtered + ", found " + count;
    }

    private static Map<String, Object> details(ResourceRequirement requirement, long count, String violation) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resourceType", requirement.resourceType());
        details.put("count", count);
        details.put("min", requirement.min());
        if (requirement.max() != null) {
            details.put("max", requirement.max());
        }
        details.put("violation", violation);
        return details;
    }
}
