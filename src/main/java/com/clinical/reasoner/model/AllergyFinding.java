package com.clinical.reasoner.model;

import java.util.List;

/**
 * An active drug that conflicts with a patient allergy
 */
public final class AllergyFinding extends Finding {

    private final String drug;
    private final AllergyEntry allergy;
    private final AllergyMatch match;

    public AllergyFinding(String drug, AllergyEntry allergy, AllergyMatch match, Severity severity,
                          String ruleId, List<String> supportingRuleIds, String mechanism,
                          String recommendation, List<String> sourceRecordIds,
                          double factConfidence, double ruleConfidence) {
        super(FindingKind.ALLERGY_CONFLICT, severity, List.of(drug, allergy.getSubstance()), ruleId,
                supportingRuleIds, mechanism, recommendation, sourceRecordIds, factConfidence, ruleConfidence);
        this.drug = drug;
        this.allergy = allergy;
        this.match = match;
    }

    public String getDrug() {
        return drug;
    }

    public AllergyEntry getAllergy() {
        return allergy;
    }

    public AllergyMatch getMatch() {
        return match;
    }

    @Override
    public String summary() {
        return drug + " with recorded allergy to " + allergy
                + (match == AllergyMatch.CROSS_REACTIVITY ? " (cross-reactivity)" : "");
    }
}
