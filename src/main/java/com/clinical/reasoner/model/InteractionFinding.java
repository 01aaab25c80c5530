package com.clinical.reasoner.model;

import java.util.List;

/**
 * Interaction between two active drugs, matched either on the exact pair or on their classes
 */
public final class InteractionFinding extends Finding {

    private final String drugA;
    private final String drugB;
    private final String classA;
    private final String classB;

    /**
     * @param drugA first drug, lexically smaller
     * @param drugB second drug
     * @param classA class of drugA that matched a class rule, null for exact matches
     * @param classB class of drugB that matched a class rule, null for exact matches
     */
    public InteractionFinding(String drugA, String drugB, String classA, String classB, Severity severity,
                              String ruleId, List<String> supportingRuleIds, String mechanism,
                              String recommendation, List<String> sourceRecordIds,
                              double factConfidence, double ruleConfidence) {
        super(classA == null ? FindingKind.DRUG_DRUG_INTERACTION : FindingKind.DRUG_CLASS_INTERACTION,
                severity, List.of(drugA, drugB), ruleId, supportingRuleIds, mechanism, recommendation,
                sourceRecordIds, factConfidence, ruleConfidence);
        this.drugA = drugA;
        this.drugB = drugB;
        this.classA = classA;
        this.classB = classB;
    }

    public String getDrugA() {
        return drugA;
    }

    public String getDrugB() {
        return drugB;
    }

    public String getClassA() {
        return classA;
    }

    public String getClassB() {
        return classB;
    }

    public boolean isExactMatch() {
        return classA == null;
    }

    @Override
    public String summary() {
        if (isExactMatch()) {
            return drugA + " + " + drugB;
        }
        return drugA + " (" + classA + ") + " + drugB + " (" + classB + ")";
    }
}
