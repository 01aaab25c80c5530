package com.clinical.reasoner.model;

import java.time.LocalDate;

/**
 * Two different drugs taken over the same dates
 */
public final class ConcurrentUse {

    private final String drugA;
    private final String drugB;
    private final LocalDate start;
    private final LocalDate end;
    private final long days;
    private final boolean significant;

    public ConcurrentUse(String drugA, String drugB, LocalDate start, LocalDate end, long days, boolean significant) {
        this.drugA = drugA;
        this.drugB = drugB;
        this.start = start;
        this.end = end;
        this.days = days;
        this.significant = significant;
    }

    public String getDrugA() {
        return drugA;
    }

    public String getDrugB() {
        return drugB;
    }

    public LocalDate getStart() {
        return start;
    }

    public LocalDate getEnd() {
        return end;
    }

    public long getDays() {
        return days;
    }

    public boolean isSignificant() {
        return significant;
    }
}
