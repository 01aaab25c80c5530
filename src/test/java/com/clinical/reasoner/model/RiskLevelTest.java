package com.clinical.reasoner.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RiskLevel
 */
public class RiskLevelTest {

    @Test
    public void testAssess_NoFindings() {
        assertEquals(RiskLevel.MINIMAL, RiskLevel.assess(List.of()));
        assertEquals(RiskLevel.MINIMAL, RiskLevel.assess(null));
    }

    @Test
    public void testAssess_ContraindicatedIsCritical() {
        List<Finding> findings = List.of(
                interaction(Severity.MAJOR),
                new ContraindicationFinding("metformin", "renal_impairment", "metformin", Severity.CONTRAINDICATED,
                        "CI-001", List.of(), "", "", List.of("rx-1"), 1.0, 0.95));

        assertEquals(RiskLevel.CRITICAL, RiskLevel.assess(findings));
    }

    @Test
    public void testAssess_MajorCounts() {
        assertEquals(RiskLevel.MODERATE, RiskLevel.assess(List.of(interaction(Severity.MAJOR))));
        assertEquals(RiskLevel.HIGH, RiskLevel.assess(List.of(interaction(Severity.MAJOR), interaction(Severity.MAJOR))));
    }

    @Test
    public void testAssess_LesserFindingsAreLow() {
        assertEquals(RiskLevel.LOW, RiskLevel.assess(List.of(interaction(Severity.MINOR))));
        assertEquals(RiskLevel.LOW, RiskLevel.assess(List.of(interaction(Severity.MODERATE), interaction(Severity.MINOR))));
    }

    private InteractionFinding interaction(Severity severity) {
        return new InteractionFinding("aspirin", "warfarin", null, null, severity, "DDI-001", List.of(),
                "", "", List.of("rx-1", "rx-2"), 1.0, 0.95);
    }
}
