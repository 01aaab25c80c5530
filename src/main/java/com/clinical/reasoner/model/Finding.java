package com.clinical.reasoner.model;

import java.util.Comparator;
import java.util.List;

/**
 * A safety finding produced by one evaluation run. The concrete subclass carries the
 * kind-specific payload; {@link #getKind()} identifies it for exhaustive switches.
 */
public abstract class Finding {

    /**
     * Severity descending, then involved entities, then kind and rule id
     */
    public static final Comparator<Finding> ORDER = Comparator
            .comparing(Finding::getSeverity, Comparator.reverseOrder())
            .thenComparing(Finding::involvedKey)
            .thenComparing(Finding::getKind)
            .thenComparing(Finding::getRuleId);

    private final FindingKind kind;
    private final Severity severity;
    private final List<String> involvedEntities;
    private final String ruleId;
    private final List<String> supportingRuleIds;
    private final String mechanism;
    private final String recommendation;
    private final List<String> sourceRecordIds;
    private final double factConfidence;
    private final double ruleConfidence;

    Finding(FindingKind kind, Severity severity, List<String> involvedEntities, String ruleId,
            List<String> supportingRuleIds, String mechanism, String recommendation,
            List<String> sourceRecordIds, double factConfidence, double ruleConfidence) {
        this.kind = kind;
        this.severity = severity;
        this.involvedEntities = List.copyOf(involvedEntities);
        this.ruleId = ruleId != null ? ruleId : "";
        this.supportingRuleIds = supportingRuleIds != null ? List.copyOf(supportingRuleIds) : List.of();
        this.mechanism = mechanism != null ? mechanism : "";
        this.recommendation = recommendation != null ? recommendation : "";
        this.sourceRecordIds = sourceRecordIds != null ? List.copyOf(sourceRecordIds) : List.of();
        this.factConfidence = factConfidence;
        this.ruleConfidence = ruleConfidence;
    }

    public FindingKind getKind() {
        return kind;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return Drug identities, or drug plus condition / allergy, in a stable order
     */
    public List<String> getInvolvedEntities() {
        return involvedEntities;
    }

    public String getRuleId() {
        return ruleId;
    }

    /**
     * @return Rules that also matched but did not determine severity
     */
    public List<String> getSupportingRuleIds() {
        return supportingRuleIds;
    }

    public String getMechanism() {
        return mechanism;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public List<String> getSourceRecordIds() {
        return sourceRecordIds;
    }

    /**
     * @return Certainty of the weakest underlying fact
     */
    public double getFactConfidence() {
        return factConfidence;
    }

    public double getRuleConfidence() {
        return ruleConfidence;
    }

    /**
     * Propagated confidence: fact certainty times rule certainty
     */
    public double getConfidence() {
        return factConfidence * ruleConfidence;
    }

    public String involvedKey() {
        return String.join("|", involvedEntities);
    }

    /**
     * One-line description of the finding
     */
    public abstract String summary();

    @Override
    public String toString() {
        return severity.label() + " " + kind.label() + ": " + summary();
    }
}
