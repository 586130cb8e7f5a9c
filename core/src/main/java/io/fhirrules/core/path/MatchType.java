package io.fhirrules.core.path;

/**
 * Strength of a match between a rule path and a target path, strongest first.
 * Declaration order is the priority order used by every consumer.
 */
public enum MatchType {
    EXACT("exact"),
    WILDCARD("wildcard"),
    PARENT("parent");

    private final String wireName;

    MatchType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
