package io.fhirrules.core.model;

/**
 * The validation layer a {@link Finding} originates from.
 *
 * <p>
 * Each layer declares once whether it is <em>blocking-capable</em>. Findings
 * from the advisory layers ({@link #LINT}, {@link #SPEC_HINT}) never block,
 * whatever severity they report.
 */
public enum FindingSource {
    /** Structural conformance of the record (schema validation). */
    STRUCTURAL("structural", true),
    /** Authored business rules. */
    BUSINESS("business", true),
    /** Code-system membership of coded values. */
    TERMINOLOGY("terminology", true),
    /** Referential integrity between resources of one record. */
    REFERENCE("reference", true),
    /** Advisory JSON-level quality checks. */
    LINT("lint", false),
    /** Advisory guidance derived from the FHIR base resource definitions. */
    SPEC_HINT("spec-hint", false);

    private final String wireName;
    private final boolean blockingCapable;

    FindingSource(String wireName, boolean blockingCapable) {
        this.wireName = wireName;
        this.blockingCapable = blockingCapable;
    }

    public String wireName() {
        return wireName;
    }

    /** Whether non-warning findings of this layer count toward non-compliance. */
    public boolean blockingCapable() {
        return blockingCapable;
    }

    /**
     * Resolves a wire name such as {@code spec-hint}.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FindingSource fromWireName(String name) {
        for (FindingSource s : values()) {
            if (s.wireName.equalsIgnoreCase(name == null ? "" : name.trim())) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown validation layer '" + name + "'");
    }
}
