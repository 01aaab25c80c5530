package com.clinical.reasoner.client;

import org.hl7.fhir.r4.model.AllergyIntolerance;
import org.hl7.fhir.r4.model.Condition;
import org.hl7.fhir.r4.model.MedicationRequest;
import org.hl7.fhir.r4.model.MedicationStatement;

import java.util.ArrayList;
import java.util.List;

/**
 * The FHIR resources retrieved for one patient, before mapping to engine inputs
 */
public class PatientRecordSet {
    private String patientId;
    private List<MedicationStatement> medicationStatements;
    private List<MedicationRequest> medicationRequests;
    private List<AllergyIntolerance> allergies;
    private List<Condition> conditions;

    public PatientRecordSet() {
        this.medicationStatements = new ArrayList<>();
        this.medicationRequests = new ArrayList<>();
        this.allergies = new ArrayList<>();
        this.conditions = new ArrayList<>();
    }

    public PatientRecordSet(String patientId, List<MedicationStatement> medicationStatements,
                            List<MedicationRequest> medicationRequests, List<AllergyIntolerance> allergies,
                            List<Condition> conditions) {
        this.patientId = patientId;
        this.medicationStatements = medicationStatements != null ? medicationStatements : new ArrayList<>();
        this.medicationRequests = medicationRequests != null ? medicationRequests : new ArrayList<>();
        this.allergies = allergies != null ? allergies : new ArrayList<>();
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }

    /**
     * @return true when no medication resource of either kind was retrieved
     */
    public boolean hasNoMedications() {
        return medicationStatements.isEmpty() && medicationRequests.isEmpty();
    }

    public String getPatientId() {
        return patientId;
    }

    public void setPatientId(String patientId) {
        this.patientId = patientId;
    }

    public List<MedicationStatement> getMedicationStatements() {
        return medicationStatements;
    }

    public void setMedicationStatements(List<MedicationStatement> medicationStatements) {
        this.medicationStatements = medicationStatements != null ? medicationStatements : new ArrayList<>();
    }

    public List<MedicationRequest> getMedicationRequests() {
        return medicationRequests;
    }

    public void setMedicationRequests(List<MedicationRequest> medicationRequests) {
        this.medicationRequests = medicationRequests != null ? medicationRequests : new ArrayList<>();
    }

    public List<AllergyIntolerance> getAllergies() {
        return allergies;
    }

    public void setAllergies(List<AllergyIntolerance> allergies) {
        this.allergies = allergies != null ? allergies : new ArrayList<>();
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions != null ? conditions : new ArrayList<>();
    }
}
