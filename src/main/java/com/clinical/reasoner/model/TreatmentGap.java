package com.clinical.reasoner.model;

import java.time.LocalDate;

/**
 * An interval in which a drug was not taken between two of its periods
 */
public final class TreatmentGap {

    private final String drugIdentity;
    private final LocalDate stoppedOn;
    private final LocalDate resumedOn;
    private final long days;

    public TreatmentGap(String drugIdentity, LocalDate stoppedOn, LocalDate resumedOn, long days) {
        this.drugIdentity = drugIdentity;
        this.stoppedOn = stoppedOn;
        this.resumedOn = resumedOn;
        this.days = days;
    }

    public String getDrugIdentity() {
        return drugIdentity;
    }

    public LocalDate getStoppedOn() {
        return stoppedOn;
    }

    public LocalDate getResumedOn() {
        return resumedOn;
    }

    public long getDays() {
        return days;
    }

    @Override
    public String toString() {
        return drugIdentity + " gap " + stoppedOn + " -> " + resumedOn + " (" + days + " days)";
    }
}
