package com.clinical.reasoner.model;

/**
 * How a medication period's end date was established
 */
public enum PeriodEnd {
    /** No end; the drug is presumed active. */
    OPEN,
    /** Explicit end date on a contributing record. */
    EXPLICIT,
    /** Closed because a later record changed dose or frequency. */
    REGIMEN_CHANGE,
    /** Closed because a later visit no longer recorded the drug. */
    VISIT_ABSENCE
}
