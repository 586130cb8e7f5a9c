package io.fhirrules.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A question/answer-set definition referenced by question-answer rules.
 *
 * @param id        question-set id
 * @param questions questions in definition order
 */
public record QuestionSet(String id, List<Question> questions) {

    public QuestionSet {
        Objects.requireNonNull(id, "id must not be null");
        questions = questions == null ? List.of() : List.copyOf(questions);
    }

    /** Finds the question identified by a Coding. */
    public Optional<Question> find(String system, String code) {
        return questions.stream().filter(q -> q.identifiedBy(system, code)).findFirst();
    }
}
