package com.clinical.reasoner.model;

import java.util.List;

/**
 * An active drug contraindicated by one of the patient's chronic conditions
 */
public final class ContraindicationFinding extends Finding {

    private final String drug;
    private final String condition;
    private final String matchedOn;

    /**
     * @param matchedOn the drug identity or therapeutic class named by the rule
     */
    public ContraindicationFinding(String drug, String condition, String matchedOn, Severity severity,
                                   String ruleId, List<String> supportingRuleIds, String mechanism,
                                   String recommendation, List<String> sourceRecordIds,
                                   double factConfidence, double ruleConfidence) {
        super(FindingKind.CONTRAINDICATION, severity, List.of(drug, condition), ruleId, supportingRuleIds,
                mechanism, recommendation, sourceRecordIds, factConfidence, ruleConfidence);
        this.drug = drug;
        this.condition = condition;
        this.matchedOn = matchedOn;
    }

    public String getDrug() {
        return drug;
    }

    public String getCondition() {
        return condition;
    }

    public String getMatchedOn() {
        return matchedOn;
    }

    @Override
    public String summary() {
        return drug + " in " + condition + (drug.equals(matchedOn) ? "" : " (class " + matchedOn + ")");
    }
}
