package com.clinical.reasoner.model;

/**
 * Non-fatal conditions the engine could not fully resolve
 */
public enum DiagnosticKind {
    INVALID_RECORD,
    CATALOG_GAP,
    AMBIGUOUS_DATE_ORDERING,
    INCOMPARABLE_DOSE_UNITS,
    PERIOD_OVERLAP
}
