package io.fhirrules.core.model;

/** Governance classification of one rule. */
public enum ReviewStatus {
    OK,
    WARNING,
    /** The rule must not be persisted. */
    BLOCKED
}
