package com.clinical.reasoner.report;

import com.clinical.reasoner.catalog.CatalogLoader;
import com.clinical.reasoner.engine.ClinicalReasoningEngine;
import com.clinical.reasoner.engine.EvaluationResult;
import com.clinical.reasoner.model.Frequency;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PatientContext;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReportGenerator
 */
public class ReportGeneratorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    private static ClinicalReasoningEngine engine;

    private ReportGenerator reportGenerator;

    @BeforeAll
    public static void createEngine() {
        engine = new ClinicalReasoningEngine(new CatalogLoader().fromClasspath("catalog/rule-catalog.json"));
    }

    @BeforeEach
    public void setUp() {
        reportGenerator = new ReportGenerator();
    }

    // ========== formatPatientResult Tests ==========

    @Test
    public void testGenerateReport_InteractionPatient() {
        EvaluationResult result = interactionResult("patient-123");

        String report = reportGenerator.generateReport(List.of(result));

        assertNotNull(report);
        assertTrue(report.contains("MEDICATION TIMELINE AND DRUG SAFETY REPORT"));
        assertTrue(report.contains("Rule catalog: 2024.1"));
        assertTrue(report.contains("Patient ID: patient-123"));
        assertTrue(report.contains("As Of: 2024-06-01"));
        assertTrue(report.contains("Risk Level: MODERATE"));
        assertTrue(report.contains("* warfarin 5mg OD from 2024-01-01, ongoing"));
        assertTrue(report.contains("Concurrent: aspirin + warfarin for "));
        assertTrue(report.contains("! [MAJOR] drug drug interaction: aspirin + warfarin (DDI-001, confidence 0.95 high)"));
        assertTrue(report.contains("Recommended: Avoid combination if possible."));
        assertFalse(report.contains("Needs Clinician Review:"));
        assertFalse(report.contains("Diagnostics:"));
    }

    @Test
    public void testGenerateReport_DoseChange() {
        EvaluationResult result = engine.evaluate("patient-456", List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "1000", Frequency.TWICE_DAILY, LocalDate.of(2024, 3, 1))),
                PatientContext.empty(AS_OF));

        String report = reportGenerator.generateReport(List.of(result));

        assertTrue(report.contains("Risk Level: MINIMAL"));
        assertTrue(report.contains("metformin 500mg BD from 2024-01-01 to 2024-03-01 (regimen changed)"));
        assertTrue(report.contains("* metformin 1000mg BD from 2024-03-01, ongoing"));
        assertTrue(report.contains("Medication Changes:"));
        assertTrue(report.contains("2024-03-01 metformin: dose increased (500mg BD -> 1000mg BD)"));
        assertTrue(report.contains("Safety Findings:\n  None"));
    }

    @Test
    public void testGenerateReport_VisitComparison() {
        EvaluationResult result = engine.evaluate("patient-457", List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "amlodipine", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-3", "metformin", "1000", Frequency.TWICE_DAILY, LocalDate.of(2024, 3, 1)),
                record("rx-4", "lisinopril", "10", Frequency.ONCE_DAILY, LocalDate.of(2024, 3, 1))),
                PatientContext.empty(AS_OF));

        String report = reportGenerator.generateReport(List.of(result));

        assertTrue(report.contains("Visit Comparison (2024-01-01 -> 2024-03-01):"));
        assertTrue(report.contains("  New: lisinopril\n"));
        assertTrue(report.contains("  Discontinued: amlodipine\n"));
        assertTrue(report.contains("  Continued: 1\n"));
        assertTrue(report.contains("  Changed: metformin dose 500mg -> 1000mg\n"));
        assertFalse(report.contains("  Restarted:"));
    }

    @Test
    public void testGenerateReport_ContraindicationIsCritical() {
        PatientContext context = new PatientContext(List.of(), List.of("renal impairment"), AS_OF);
        EvaluationResult result = engine.evaluate("patient-789", List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1))), context);

        String report = reportGenerator.generateReport(List.of(result));

        assertTrue(report.contains("Risk Level: CRITICAL - CONTRAINDICATED COMBINATION PRESENT"));
        assertTrue(report.contains("✗ [CONTRAINDICATED] contraindication: "));
        assertTrue(report.contains("CI-001"));
        assertFalse(report.contains("Visit Comparison"));
    }

    @Test
    public void testGenerateReport_LowConfidenceGoesToReview() {
        EvaluationResult result = engine.evaluate("patient-100", List.of(
                MedicationRecord.builder().drugName("warfarin").dose("5", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).sourcePrescriptionId("note-1")
                        .extractionConfidence(0.3).build(),
                record("rx-2", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1))),
                PatientContext.empty(AS_OF));

        String report = reportGenerator.generateReport(List.of(result));

        assertTrue(report.contains("Risk Level: MINIMAL"));
        assertTrue(report.contains("Needs Clinician Review:"));
        assertTrue(report.contains("  ? Needs clinician review: confidence "));
        assertTrue(report.contains("warfarin: started [review]"));
    }

    @Test
    public void testGenerateReport_InvalidRecordsListedAsDiagnostics() {
        EvaluationResult result = engine.evaluate("patient-200", List.of(
                MedicationRecord.builder().dose("5", "mg").observedDate(LocalDate.of(2024, 1, 1))
                        .sourcePrescriptionId("rx-9").build()),
                PatientContext.empty(AS_OF));

        String report = reportGenerator.generateReport(List.of(result));

        assertTrue(report.contains("(no valid medication records)"));
        assertTrue(report.contains("Diagnostics:"));
        assertTrue(report.contains("  - INVALID_RECORD ["));
    }

    // ========== generateSummary Tests ==========

    @Test
    public void testGenerateSummary_MultiplePatients() {
        EvaluationResult interaction = interactionResult("patient-1");
        EvaluationResult quiet = engine.evaluate("patient-2", List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1))),
                PatientContext.empty(AS_OF));

        String report = reportGenerator.generateReport(List.of(interaction, quiet));

        assertTrue(report.contains("SUMMARY"));
        assertTrue(report.contains("Total Patients Evaluated: 2"));
        assertTrue(report.contains("  - Critical Risk: 0"));
        assertTrue(report.contains("  - Moderate Risk: 1"));
        assertTrue(report.contains("  - Minimal Risk: 1"));
        assertTrue(report.contains("Safety Findings: 1 (1 major or contraindicated)"));
        assertTrue(report.contains("Items Needing Clinician Review: 0"));
        assertTrue(report.indexOf("Patient ID: patient-1") < report.indexOf("Patient ID: patient-2"));
    }

    @Test
    public void testGenerateReport_EmptyList() {
        assertEquals("No patients evaluated.", reportGenerator.generateReport(List.of()));
        assertEquals("No patients evaluated.", reportGenerator.generateReport(null));
    }

    private static EvaluationResult interactionResult(String patientId) {
        return engine.evaluate(patientId, List.of(
                record("rx-1", "warfarin", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 5, 20))),
                PatientContext.empty(AS_OF));
    }

    private static MedicationRecord record(String id, String drug, String mg, Frequency frequency, LocalDate date) {
        return MedicationRecord.builder()
                .drugName(drug)
                .dose(mg, "mg")
                .frequency(frequency)
                .observedDate(date)
                .sourcePrescriptionId(id)
                .build();
    }
}
