package io.fhirrules.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * One question of a {@link QuestionSet}, identified by its Coding.
 *
 * @param id              question id
 * @param system          code system of the question Coding
 * @param code            code of the question Coding
 * @param display         display text, may be {@code null}
 * @param answerType      declared answer type
 * @param min             lower bound for numeric answers, or {@code null}
 * @param max             upper bound for numeric answers, or {@code null}
 * @param allowedCodes    allowed answer codes for coded answers; empty allows
 *                        any
 * @param answerSystem    code system of coded answers, or {@code null}
 * @param multipleAllowed whether several answer values are accepted
 */
public record Question(
        String id,
        String system,
        String code,
        String display,
        AnswerType answerType,
        BigDecimal min,
        BigDecimal max,
        List<String> allowedCodes,
        String answerSystem,
        boolean multipleAllowed) {

    public Question {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(answerType, "answerType must not be null");
        allowedCodes = allowedCodes == null ? List.of() : List.copyOf(allowedCodes);
    }

    /** Whether the Coding {@code (system, code)} identifies this question. */
    public boolean identifiedBy(String codingSystem, String codingCode) {
        return code.equals(codingCode) && (system == null || system.equals(codingSystem));
    }
}
