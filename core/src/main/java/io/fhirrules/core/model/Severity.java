package io.fhirrules.core.model;

import java.util.Locale;

/**
 * Severity of a rule or finding. Wire names are lower-case, as they appear in
 * rule-set files.
 */
public enum Severity {
    ERROR("error"),
    WARNING("warning"),
    INFORMATION("information");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    /** The lower-case name used in rule-set files. */
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a wire name (case-insensitive). {@code info} is accepted as an
     * alias for {@code information}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static Severity fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Severity must not be null");
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        if ("info".equals(lower)) {
            return INFORMATION;
        }
        for (Severity s : values()) {
            if (s.wireName.equals(lower)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity '" + name + "'; expected error, warning or information");
    }
}
