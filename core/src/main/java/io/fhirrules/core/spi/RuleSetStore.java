package io.fhirrules.core.spi;

import io.fhirrules.core.model.RuleSet;

/**
 * Persistence collaborator for rule sets. Owned by the host application.
 */
public interface RuleSetStore {

    /**
     * Atomically replaces the persisted rule set with the same id. Called only
     * after a review with no blocked rule.
     *
     * @param ruleSet the reviewed rule set
     */
    void replace(RuleSet ruleSet);
}
