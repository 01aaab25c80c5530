package com.clinical.reasoner.catalog;

import com.clinical.reasoner.model.Severity;

/**
 * A pairwise interaction rule, either between two drugs or between two therapeutic classes.
 * Operands are stored in lexical order so the rule is symmetric.
 */
public final class InteractionRule {

    private final String id;
    private final String first;
    private final String second;
    private final Severity severity;
    private final String mechanism;
    private final String management;
    private final String evidence;
    private final boolean classLevel;

    public InteractionRule(String id, String a, String b, Severity severity, String mechanism,
                           String management, String evidence, boolean classLevel) {
        this.id = id;
        this.first = a.compareTo(b) <= 0 ? a : b;
        this.second = a.compareTo(b) <= 0 ? b : a;
        this.severity = severity;
        this.mechanism = mechanism != null ? mechanism : "";
        this.management = management != null ? management : "";
        this.evidence = evidence != null ? evidence : (classLevel ? "class-based" : "established");
        this.classLevel = classLevel;
    }

    public String getId() {
        return id;
    }

    public String getFirst() {
        return first;
    }

    public String getSecond() {
        return second;
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

    public String getEvidence() {
        return evidence;
    }

    public boolean isClassLevel() {
        return classLevel;
    }
}
