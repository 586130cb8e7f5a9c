package io.fhirrules.core.model;

/** Declared answer type of a {@link Question}. */
public enum AnswerType {
    CODE,
    QUANTITY,
    INTEGER,
    DECIMAL,
    STRING,
    BOOLEAN
}
