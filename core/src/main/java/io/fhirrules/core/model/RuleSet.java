package io.fhirrules.core.model;

import io.fhirrules.core.error.RuleConfigurationException;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An ordered rule set. Order is significant: first-match-wins in coverage and
 * finding order in evaluation both follow it.
 *
 * @param id      rule-set id
 * @param version rule-set version, may be {@code null}
 * @param rules   rules in authoring order, ids unique
 */
public record RuleSet(String id, String version, List<Rule> rules) {

    public RuleSet {
        Objects.requireNonNull(id, "id must not be null");
        rules = rules == null ? List.of() : List.copyOf(rules);
        Set<String> ids = new HashSet<>();
        for (Rule r : rules) {
            if (!ids.add(r.id())) {
                throw new RuleConfigurationException("Rule set '" + id + "' contains rule id '" + r.id() + "' twice", r.id());
            }
        }
    }

    /** Rule set with no version. */
    public static RuleSet of(String id, List<Rule> rules) {
        return new RuleSet(id, null, rules);
    }
}
