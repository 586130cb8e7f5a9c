package io.fhirrules.core.engine.layer;

import com.fasterxml.jackson.databind.JsonNode;
import io.fhirrules.core.config.ReferencePolicy;
import io.fhirrules.core.model.ErrorCodes;
import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.Location;
import io.fhirrules.core.model.Severity;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Referential integrity within one record.
 *
 * <p>
 * Targets are looked up by the entry's {@code fullUrl} and by
 * {@code ResourceType/id}. An absolute URL ending in {@code Type/id} also
 * resolves through its last two segments. Contained references
 * ({@code #id}) are not checked. Each distinct reference string is checked
 * once per resource.
 *
 * <ul>
 * <li>unresolved: {@code REFERENCE_NOT_FOUND}, error under
 * {@link ReferencePolicy#IN_BUNDLE_ONLY}, warning under
 * {@link ReferencePolicy#ALLOW_EXTERNAL};</li>
 * <li>resolved to a resource of another type than the reference declares:
 * {@code REFERENCE_TYPE_MISMATCH}, always an error.</li>
 * </ul>
 */
public final class ReferenceIntegrityLayer implements ValidationLayer {

    private static final Pattern TYPED_ID = Pattern.compile("(?:^|/)([A-Z][A-Za-z]+)/([A-Za-z0-9\\-.]{1,64})$");

    private final ReferencePolicy policy;

    public ReferenceIntegrityLayer(ReferencePolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    @Override
    public FindingSource source() {
        return FindingSource.REFERENCE;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        Map<String, Location> lookup = buildLookup(record);
        List<Finding> findings = new ArrayList<>();
        for (Location entry : record.entries()) {
            Set<String> seen = new HashSet<>();
            TreeWalker.walk(entry.resource(), entry.path(), (path, node) -> {
                JsonNode ref = node.get("reference");
                if (!node.isObject() || ref == null || !ref.isTextual()) {
                    return;
                }
                String reference = ref.asText().trim();
                if (reference.isEmpty() || reference.startsWith("#") || !seen.add(reference)) {
                    return;
                }
                check(entry, path + ".reference", reference, node.path("type").asText(null), lookup)
                        .ifPresent(findings::add);
            });
        }
        return findings;
    }

    private Optional<Finding> check(
            Location entry, String path, String reference, String declaredType, Map<String, Location> lookup) {
        Location target = resolve(reference, lookup);
        Matcher typed = TYPED_ID.matcher(reference);
        String expectedType = declaredType != null ? declaredType : typed.find() ? typed.group(1) : null;
        if (target == null) {
            Severity severity = policy == ReferencePolicy.ALLOW_EXTERNAL ? Severity.WARNING : Severity.ERROR;
            return Optional.of(finding(
                    severity,
                    ErrorCodes.REFERENCE_NOT_FOUND,
                    entry,
                    path,
                    "Reference '" + reference + "' does not resolve within the record",
                    Map.of("reference", reference, "policy", policy.wireName())));
        }
        if (expectedType != null && !expectedType.equals(target.resourceType())) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reference", reference);
            details.put("expectedType", expectedType);
            details.put("actualType", target.resourceType());
            return Optional.of(finding(
                    Severity.ERROR,
                    ErrorCodes.REFERENCE_TYPE_MISMATCH,
                    entry,
                    path,
                    "Reference '" + reference + "' points to a " + target.resourceType() + ", expected "
                            + expectedType,
                    details));
        }
        return Optional.empty();
    }

    private static Location resolve(String reference, Map<String, Location> lookup) {
        Location direct = lookup.get(reference);
        if (direct != null) {
            return direct;
        }
        Matcher typed = TYPED_ID.matcher(reference);
        if (typed.find()) {
            return lookup.get(typed.group(1) + "/" + typed.group(2));
        }
        return null;
    }

    private static Map<String, Location> buildLookup(FhirRecord record) {
        Map<String, Location> lookup = new HashMap<>();
        for (Location entry : record.entries()) {
            if (entry.fullUrl() != null) {
                lookup.putIfAbsent(entry.fullUrl(), entry);
            }
            if (entry.resourceId() != null) {
                lookup.putIfAbsent(entry.resourceType() + "/" + entry.resourceId(), entry);
            }
        }
        return lookup;
    }

    private static Finding finding(
            Severity severity, String code, Location entry, String path, String message, Map<String, Object> details) {
        return new Finding(FindingSource.REFERENCE, severity, path, message, code, null, entry.resourceType(), details);
    }
}
