package com.clinical.reasoner.main;

import com.clinical.reasoner.catalog.CatalogLoader;
import com.clinical.reasoner.client.FhirClient;
import com.clinical.reasoner.client.FhirRecordMapper;
import com.clinical.reasoner.client.PatientRecordSet;
import com.clinical.reasoner.engine.ClinicalReasoningEngine;
import com.clinical.reasoner.engine.EvaluationResult;
import com.clinical.reasoner.model.RiskLevel;
import org.hl7.fhir.r4.model.CodeableConcept;
import org.hl7.fhir.r4.model.MedicationStatement;
import org.hl7.fhir.r4.model.Period;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MedicationSafetyApp
 */
public class MedicationSafetyAppTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    // ========== Option Parsing Tests ==========

    @Test
    public void testParse_Defaults() {
        MedicationSafetyApp.AppOptions options = MedicationSafetyApp.AppOptions.parse(new String[0]);

        assertEquals(LocalDate.now(), options.getAsOfDate());
        assertEquals(20, options.getMaxPatients());
        assertFalse(options.isJson());
        assertTrue(options.getPatientIds().isEmpty());
    }

    @Test
    public void testParse_AllOptions() {
        MedicationSafetyApp.AppOptions options = MedicationSafetyApp.AppOptions.parse(
                new String[]{"--as-of=2024-06-01", "--max=5", "--json", "patient-1", " ", "patient-2"});

        assertEquals(AS_OF, options.getAsOfDate());
        assertEquals(5, options.getMaxPatients());
        assertTrue(options.isJson());
        assertEquals(List.of("patient-1", "patient-2"), options.getPatientIds());
    }

    @Test
    public void testParse_RejectsMalformedOptions() {
        assertThrows(IllegalArgumentException.class,
                () -> MedicationSafetyApp.AppOptions.parse(new String[]{"--as-of=06/01/2024"}));
        assertThrows(IllegalArgumentException.class,
                () -> MedicationSafetyApp.AppOptions.parse(new String[]{"--max=ten"}));
        assertThrows(IllegalArgumentException.class,
                () -> MedicationSafetyApp.AppOptions.parse(new String[]{"--max=0"}));
        assertThrows(IllegalArgumentException.class,
                () -> MedicationSafetyApp.AppOptions.parse(new String[]{"--verbose"}));
    }

    // ========== Parallel Processing Tests ==========

    @Test
    public void testProcessPatientsInParallel_KeepsOrderAndSkipsFailures() {
        FhirClient fhirClient = new FhirClient("http://localhost:8080/fhir") {
            @Override
            public PatientRecordSet getPatientRecords(String patientId) {
                if (patientId.equals("broken")) {
                    throw new IllegalStateException("Server unavailable");
                }
                return new PatientRecordSet(patientId, List.of(statement(patientId)), List.of(), List.of(), List.of());
            }
        };
        ClinicalReasoningEngine engine = new ClinicalReasoningEngine(
                new CatalogLoader().fromClasspath("catalog/rule-catalog.json"));

        List<EvaluationResult> results = MedicationSafetyApp.processPatientsInParallel(
                List.of("patient-1", "broken", "patient-2"), fhirClient, new FhirRecordMapper(), engine, AS_OF, 2);

        assertEquals(List.of("patient-1", "patient-2"), results.stream().map(EvaluationResult::getPatientId).toList());
        for (EvaluationResult result : results) {
            assertEquals(AS_OF, result.getAsOfDate());
            assertEquals(RiskLevel.MINIMAL, result.getRiskLevel());
            assertTrue(result.getTimeline().getActiveDrugs().contains("metformin"));
        }
    }

    @Test
    public void testProcessPatientsInParallel_UnreachableServerYieldsNoResults() {
        FhirClient fhirClient = new FhirClient("http://127.0.0.1:1/fhir", new long[]{0});
        ClinicalReasoningEngine engine = new ClinicalReasoningEngine(
                new CatalogLoader().fromClasspath("catalog/rule-catalog.json"));

        List<EvaluationResult> results = MedicationSafetyApp.processPatientsInParallel(
                List.of("patient-1", "patient-2"), fhirClient, new FhirRecordMapper(), engine, AS_OF, 2);

        assertTrue(results.isEmpty());
    }

    private static MedicationStatement statement(String patientId) {
        MedicationStatement statement = new MedicationStatement();
        statement.setId("ms-" + patientId);
        statement.setStatus(MedicationStatement.MedicationStatementStatus.ACTIVE);
        statement.setMedication(new CodeableConcept().setText("Metformin 500 MG Oral Tablet"));
        statement.setEffective(new Period().setStart(
                Date.from(LocalDate.of(2024, 1, 1).atStartOfDay(ZoneId.systemDefault()).toInstant())));
        return statement;
    }
}
