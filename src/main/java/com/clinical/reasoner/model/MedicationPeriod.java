package com.clinical.reasoner.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A contiguous range [start, end) over which one drug was taken at one regimen.
 * End is null while the drug is presumed active.
 */
public final class MedicationPeriod {

    private final String drugIdentity;
    private final LocalDate startDate;
    private final LocalDate endDate;
    private final PeriodEnd endKind;
    private final Dose dose;
    private final Frequency frequency;
    private final Route route;
    private final List<String> sourceRecordIds;
    private final List<String> conflictingRecordIds;
    private final List<LocalDate> observationDates;
    private final double confidence;

    public MedicationPeriod(String drugIdentity, LocalDate startDate, LocalDate endDate, PeriodEnd endKind,
                            Dose dose, Frequency frequency, Route route,
                            List<String> sourceRecordIds, List<String> conflictingRecordIds,
                            List<LocalDate> observationDates, double confidence) {
        this.drugIdentity = drugIdentity;
        this.startDate = startDate;
        this.endDate = endDate;
        this.endKind = endDate == null ? PeriodEnd.OPEN : endKind;
        this.dose = dose;
        this.frequency = frequency;
        this.route = route;
        this.sourceRecordIds = sourceRecordIds != null ? List.copyOf(sourceRecordIds) : List.of();
        this.conflictingRecordIds = conflictingRecordIds != null ? List.copyOf(conflictingRecordIds) : List.of();
        this.observationDates = observationDates != null ? List.copyOf(observationDates) : List.of(startDate);
        this.confidence = confidence;
    }

    public boolean isOpen() {
        return endDate == null;
    }

    /**
     * A period is active on a date when it has started and has not yet ended
     * @param date The as-of date
     * @return true if start &lt;= date and (end is open or end &gt; date)
     */
    public boolean isActiveOn(LocalDate date) {
        return !startDate.isAfter(date) && (endDate == null || endDate.isAfter(date));
    }

    /**
     * @return true when two or more records disagreed on the regimen at this period's start date
     */
    public boolean isAmbiguous() {
        return !conflictingRecordIds.isEmpty();
    }

    public boolean sameRegimen(MedicationPeriod other) {
        return dose.sameAmount(other.dose) && frequency == other.frequency;
    }

    public String regimenText() {
        return dose + " " + frequency.getCode();
    }

    public String getDrugIdentity() {
        return drugIdentity;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public PeriodEnd getEndKind() {
        return endKind;
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

    public List<String> getSourceRecordIds() {
        return sourceRecordIds;
    }

    public List<String> getConflictingRecordIds() {
        return conflictingRecordIds;
    }

    /**
     * @return Visit dates whose records were merged into this period, ascending, starting with the start date
     */
    public List<LocalDate> getObservationDates() {
        return observationDates;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return drugIdentity + " " + regimenText() + " [" + startDate + ", " + (endDate == null ? "open" : endDate) + ")";
    }
}
