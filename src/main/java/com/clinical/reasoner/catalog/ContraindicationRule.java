package com.clinical.reasoner.catalog;

import com.clinical.reasoner.model.Severity;

/**
 * A drug (or therapeutic class) that should be avoided in a condition
 */
public final class ContraindicationRule {

    private final String id;
    private final String drugOrClass;
    private final String condition;
    private final Severity severity;
    private final String mechanism;
    private final String management;

    public ContraindicationRule(String id, String drugOrClass, String condition, Severity severity,
                                String mechanism, String management) {
        this.id = id;
        this.drugOrClass = drugOrClass;
        this.condition = condition;
        this.severity = severity;
        this.mechanism = mechanism != null ? mechanism : "";
        this.management = management != null ? management : "";
    }

    public String getId() {
        return id;
    }

    public String getDrugOrClass() {
        return drugOrClass;
    }

    public String getCondition() {
        return condition;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMechanism() {
        return mechanism;
    }

    public String getManagement() {
        return management;
    }
}
