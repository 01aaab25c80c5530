package com.clinical.reasoner.catalog;

import com.clinical.reasoner.model.Severity;

/**
 * An allergen whose allergy carries risk for a different drug or class
 */
public final class CrossReactivityRule {

    private final String id;
    private final String allergen;
    private final String drugOrClass;
    private final Severity severity;
    private final String mechanism;
    private final String management;

    public CrossReactivityRule(String id, String allergen, String drugOrClass, Severity severity,
                               String mechanism, String management) {
        this.id = id;
        this.allergen = allergen;
        this.drugOrClass = drugOrClass;
        this.severity = severity;
        this.mechanism = mechanism != null ? mechanism : "";
        this.management = management != null ? management : "";
    }

    public String getId() {
        return id;
    }

    public String getAllergen() {
        return allergen;
    }

    public String getDrugOrClass() {
        return drugOrClass;
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
