package com.clinical.reasoner.model;

import java.time.LocalDate;

/**
 * Two periods of the same drug whose date ranges overlap with different regimens.
 * Both periods are kept in the timeline; the overlap is reported rather than merged away.
 */
public final class PeriodOverlap {

    private final String drugIdentity;
    private final MedicationPeriod first;
    private final MedicationPeriod second;
    private final LocalDate overlapStart;
    private final LocalDate overlapEnd;

    public PeriodOverlap(String drugIdentity, MedicationPeriod first, MedicationPeriod second,
                         LocalDate overlapStart, LocalDate overlapEnd) {
        this.drugIdentity = drugIdentity;
        this.first = first;
        this.second = second;
        this.overlapStart = overlapStart;
        this.overlapEnd = overlapEnd;
    }

    /**
     * @return true when the overlap is still in effect on the given date
     */
    public boolean isActiveOn(LocalDate date) {
        return first.isActiveOn(date) && second.isActiveOn(date);
    }

    public String getDrugIdentity() {
        return drugIdentity;
    }

    public MedicationPeriod getFirst() {
        return first;
    }

    public MedicationPeriod getSecond() {
        return second;
    }

    public LocalDate getOverlapStart() {
        return overlapStart;
    }

    public LocalDate getOverlapEnd() {
        return overlapEnd;
    }
}
