package io.fhirrules.core.engine;

import io.fhirrules.core.model.FhirRecord;
import io.fhirrules.core.model.Finding;
import io.fhirrules.core.model.FindingSource;
import io.fhirrules.core.model.QuestionSet;
import io.fhirrules.core.model.Rule;
import io.fhirrules.core.model.RuleSet;
import io.fhirrules.core.spi.ValidationLayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The business layer: every rule of a rule set, in rule-set order, through
 * {@link RuleEvaluator}. The first rule that cannot be evaluated aborts the
 * layer.
 */
public final class BusinessRuleLayer implements ValidationLayer {

    private final RuleSet ruleSet;
    private final Map<String, QuestionSet> questionSets;

    public BusinessRuleLayer(RuleSet ruleSet, Map<String, QuestionSet> questionSets) {
        this.ruleSet = Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        this.questionSets = questionSets == null ? Map.of() : Map.copyOf(questionSets);
    }

    @Override
    public FindingSource source() {
        return FindingSource.BUSINESS;
    }

    @Override
    public List<Finding> validate(FhirRecord record) {
        List<Finding> findings = new ArrayList<>();
        for (Rule rule : ruleSet.rules()) {
            findings.addAll(RuleEvaluator.evaluate(rule, record, questionSets));
        }
        return findings;
    }
}
