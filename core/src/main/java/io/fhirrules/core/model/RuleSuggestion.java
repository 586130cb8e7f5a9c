package io.fhirrules.core.model;

import java.util.Objects;

/**
 * A candidate rule proposed to the author, identified by the path it would
 * cover. Used only for coverage.
 *
 * @param id   suggestion id
 * @param path suggested path, may contain {@code [*]}
 */
public record RuleSuggestion(String id, String path) {

    public RuleSuggestion {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(path, "path must not be null");
    }
}
