package com.clinical.reasoner.model;

import java.util.List;

/**
 * Overall medication risk across the headline findings of one evaluation
 */
public enum RiskLevel {
    CRITICAL,
    HIGH,
    MODERATE,
    LOW,
    MINIMAL;

    /**
     * Any contraindicated finding is critical; two or more major findings are high;
     * a single major finding is moderate; any other finding is low.
     * @param findings Headline findings
     * @return Overall risk level
     */
    public static RiskLevel assess(List<? extends Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return MINIMAL;
        }
        long contraindicated = findings.stream()
                .filter(f -> f.getSeverity() == Severity.CONTRAINDICATED)
                .count();
        long major = findings.stream()
                .filter(f -> f.getSeverity() == Severity.MAJOR)
                .count();
        if (contraindicated > 0) {
            return CRITICAL;
        } else if (major >= 2) {
            return HIGH;
        } else if (major == 1) {
            return MODERATE;
        }
        return LOW;
    }
}
