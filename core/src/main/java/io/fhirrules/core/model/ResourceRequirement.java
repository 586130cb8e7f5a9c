package io.fhirrules.core.model;

import io.fhirrules.core.error.RuleConfigurationException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * One declared requirement of a resource-composition rule: the record must
 * contain between {@code min} and {@code max} instances of
 * {@code resourceType} satisfying all {@code where} filters.
 *
 * @param resourceType the required resource type
 * @param min          minimum count, at least 0
 * @param max          maximum count, or {@code null} for unbounded
 * @param where        filters an instance must satisfy to count; may be empty
 */
public record ResourceRequirement(String resourceType, int min, Integer max, List<ScopeFilter> where) {

    public ResourceRequirement {
        if (resourceType == null || resourceType.isBlank()) {
            throw new RuleConfigurationException("Resource requirement needs a resourceType", null);
        }
        if (min < 0) {
            throw new RuleConfigurationException(
                    "Resource requirement for " + resourceType + ": min must be >= 0, got " + min, null);
        }
        if (max != null && max < min) {
            throw new RuleConfigurationException(
                    "Resource requirement for " + resourceType + ": max " + max + " is below min " + min, null);
        }
        where = where == null ? List.of() : List.copyOf(where);
    }

    /** Requirement for exactly {@code count} instances. */
    public static ResourceRequirement exactly(String resourceType, int count) {
        return new ResourceRequirement(resourceType, count, count, List.of());
    }

    /** Requirement for at least {@code min} instances. */
    public static ResourceRequirement atLeast(String resourceType, int min) {
        return new ResourceRequirement(resourceType, min, null, List.of());
    }

    /** Key identifying the requirement's target: type plus filters. */
    public String targetKey() {
        return resourceType + where.stream().map(ScopeFilter::stableKey).collect(Collectors.joining("&", "[", "]"));
    }
}
