package io.fhirrules.core.model;

/** Coverage of one schema path. Covered dominates suggested, which dominates uncovered. */
public enum CoverageStatus {
    COVERED("covered"),
    SUGGESTED("suggested"),
    UNCOVERED("uncovered");

    private final String wireName;

    CoverageStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
