package io.fhirrules.core.config;

import java.util.Locale;

/**
 * How the reference layer treats a reference that does not resolve inside the
 * record.
 */
public enum ReferencePolicy {
    /** Unresolved references are errors. */
    IN_BUNDLE_ONLY("in-bundle-only"),
    /** Unresolved references are warnings; they may point to an external server. */
    ALLOW_EXTERNAL("allow-external");

    private final String wireName;

    ReferencePolicy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** @throws IllegalArgumentException if the name is unknown */
    public static ReferencePolicy fromWireName(String name) {
        String lower = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        for (ReferencePolicy p : values()) {
            if (p.wireName.equals(lower)) {
                return p;
            }
        }
        throw new IllegalArgumentException(
                "Unknown reference policy '" + name + "'; expected in-bundle-only or allow-external");
    }
}
