package io.fhirrules.core.engine;

import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.InstanceScope;
import io.fhirrules.core.model.Location;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a rule's {@link InstanceScope} into the concrete locations it is
 * evaluated against, in document order.
 *
 * <p>
 * A record without any instance of the owning type resolves to an empty list
 * for every scope kind. Absence is not a failure here; a rule that wants to
 * report absence is written as its own rule.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class InstanceScopeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(InstanceScopeResolver.class);

    private InstanceScopeResolver() {}

    /**
     * Resolves the scope.
     *
     * @param scope        the rule's scope
     * @param resourceType the owning resource type
     * @param record       the record under validation
     * @return matching locations in document order, possibly empty
     */
    public static List<Location> resolve(InstanceScope scope, String resourceType, FhirRecord record) {
        List<Location> candidates = record.instancesOf(resourceType);
        List<Location> resolved;
        if (candidates.isEmpty()) {
            resolved = List.of();
        } else if (scope instanceof InstanceScope.First) {
            resolved = List.of(candidates.get(0));
        } else if (scope instanceof InstanceScope.Filtered filtered) {
            resolved = candidates.stream()
                    .filter(l -> PredicateEvaluator.matches(filtered.filter(), l.resource()))
                    .toList();
        } else {
            resolved = candidates;
        }
        LOG.debug(
                "Resolved scope {} for {}: {} of {} instance(s)",
                scope.stableKey(),
                resourceType,
                resolved.size(),
                candidates.size());
        return resolved;
    }
}
