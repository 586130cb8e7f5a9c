package io.fhirrules.core.model;

/** Overall compliance verdict of a record. */
public enum Verdict {
    /** No findings at all. */
    COMPLIANT,
    /** No blocking findings, but at least one non-blocking one. */
    COMPLIANT_WITH_RECOMMENDATIONS,
    /** At least one blocking finding. */
    NON_COMPLIANT;

    /** Whether the record passes validation. */
    public boolean isCompliant() {
        return this != NON_COMPLIANT;
    }
}
