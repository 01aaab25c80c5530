package com.clinical.reasoner.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A single normalized medication observation taken from one prescription.
 * Immutable; instances are produced by the upstream extraction and normalization step
 * or by {@code FhirRecordMapper}.
 */
public final class MedicationRecord {

    private final String drugName;
    private final Dose dose;
    private final Frequency frequency;
    private final Route route;
    private final LocalDate observedDate;
    private final LocalDate explicitEndDate;
    private final LocalDate visitDate;
    private final String sourcePrescriptionId;
    private final String prescriber;
    private final Instant recordedAt;
    private final double extractionConfidence;
    private final List<String> diagnoses;
    private final List<String> symptoms;

    private MedicationRecord(Builder b) {
        this.drugName = b.drugName;
        this.dose = b.dose != null ? b.dose : Dose.unspecified();
        this.frequency = b.frequency != null ? b.frequency : Frequency.UNSPECIFIED;
        this.route = b.route != null ? b.route : Route.OTHER;
        this.observedDate = b.observedDate;
        this.explicitEndDate = b.explicitEndDate;
        this.visitDate = b.visitDate != null ? b.visitDate : b.observedDate;
        this.sourcePrescriptionId = b.sourcePrescriptionId;
        this.prescriber = b.prescriber;
        this.recordedAt = b.recordedAt;
        this.extractionConfidence = b.extractionConfidence;
        this.diagnoses = normalizeAll(b.diagnoses);
        this.symptoms = normalizeAll(b.symptoms);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Canonical drug identity: trimmed, lower-cased generic name
     * @return Drug identity, or null when the record carries no drug name
     */
    public String getDrugIdentity() {
        if (drugName == null || drugName.isBlank()) {
            return null;
        }
        return drugName.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * @return true when dose and frequency match the other record's regimen
     */
    public boolean sameRegimen(MedicationRecord other) {
        return dose.sameAmount(other.dose) && frequency == other.frequency;
    }

    /**
     * Human-readable regimen, e.g. "500mg BD"
     */
    public String regimenText() {
        return dose + " " + frequency.getCode();
    }

    public String getDrugName() {
        return drugName;
    }

    public Dose getDose() {
        return dose;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public Route getRoute() {
        return route;
    }

    public LocalDate getObservedDate() {
        return observedDate;
    }

    public LocalDate getExplicitEndDate() {
        return explicitEndDate;
    }

    public LocalDate getVisitDate() {
        return visitDate;
    }

    public String getSourcePrescriptionId() {
        return sourcePrescriptionId;
    }

    public String getPrescriber() {
        return prescriber;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public double getExtractionConfidence() {
        return extractionConfidence;
    }

    public List<String> getDiagnoses() {
        return diagnoses;
    }

    public List<String> getSymptoms() {
        return symptoms;
    }

    private static List<String> normalizeAll(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(values.stream()
                .filter(Objects::nonNull)
                .map(PatientContext::normalizeCondition)
                .filter(v -> !v.isEmpty())
                .distinct()
                .collect(Collectors.toList()));
    }

    @Override
    public String toString() {
        return "MedicationRecord[" + sourcePrescriptionId + ": " + drugName + " " + regimenText()
                + " from " + observedDate + (explicitEndDate != null ? " to " + explicitEndDate : "") + "]";
    }

    public static final class Builder {
        private String drugName;
        private Dose dose;
        private Frequency frequency;
        private Route route;
        private LocalDate observedDate;
        private LocalDate explicitEndDate;
        private LocalDate visitDate;
        private String sourcePrescriptionId;
        private String prescriber;
        private Instant recordedAt;
        private double extractionConfidence = 1.0;
        private final List<String> diagnoses = new ArrayList<>();
        private final List<String> symptoms = new ArrayList<>();

        private Builder() {
        }

        public Builder drugName(String drugName) {
            this.drugName = drugName;
            return this;
        }

        public Builder dose(Dose dose) {
            this.dose = dose;
            return this;
        }

        public Builder dose(String value, String unit) {
            this.dose = Dose.of(value, unit);
            return this;
        }

        public Builder frequency(Frequency frequency) {
            this.frequency = frequency;
            return this;
        }

        public Builder route(Route route) {
            this.route = route;
            return this;
        }

        public Builder observedDate(LocalDate observedDate) {
            this.observedDate = observedDate;
            return this;
        }

        public Builder explicitEndDate(LocalDate explicitEndDate) {
            this.explicitEndDate = explicitEndDate;
            return this;
        }

        public Builder visitDate(LocalDate visitDate) {
            this.visitDate = visitDate;
            return this;
        }

        public Builder sourcePrescriptionId(String sourcePrescriptionId) {
            this.sourcePrescriptionId = sourcePrescriptionId;
            return this;
        }

        public Builder prescriber(String prescriber) {
            this.prescriber = prescriber;
            return this;
        }

        public Builder recordedAt(Instant recordedAt) {
            this.recordedAt = recordedAt;
            return this;
        }

        public Builder extractionConfidence(double extractionConfidence) {
            this.extractionConfidence = extractionConfidence;
            return this;
        }

        public Builder diagnosis(String diagnosis) {
            this.diagnoses.add(diagnosis);
            return this;
        }

        public Builder diagnoses(List<String> diagnoses) {
            if (diagnoses != null) {
                this.diagnoses.addAll(diagnoses);
            }
            return this;
        }

        public Builder symptom(String symptom) {
            this.symptoms.add(symptom);
            return this;
        }

        public Builder symptoms(List<String> symptoms) {
            if (symptoms != null) {
                this.symptoms.addAll(symptoms);
            }
            return this;
        }

        public MedicationRecord build() {
            return new MedicationRecord(this);
        }
    }
}
