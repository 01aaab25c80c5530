package com.clinical.reasoner.model;

import java.time.LocalDate;
import java.util.List;

/**
 * A classified transition in one drug's timeline, dated at the visit where it was observed
 */
public final class ChangeEvent {

    private final String drugIdentity;
    private final LocalDate date;
    private final ChangeKind kind;
    private final String previousValue;
    private final String newValue;
    private final List<String> sourceRecordIds;
    private final List<String> conflictingRecordIds;
    private final double confidence;
    private final boolean overlapping;
    private final TreatmentGap gap;

    public ChangeEvent(String drugIdentity, LocalDate date, ChangeKind kind,
                       String previousValue, String newValue,
                       List<String> sourceRecordIds, List<String> conflictingRecordIds,
                       double confidence, boolean overlapping, TreatmentGap gap) {
        this.drugIdentity = drugIdentity;
        this.date = date;
        this.kind = kind;
        this.previousValue = previousValue;
        this.newValue = newValue;
        this.sourceRecordIds = sourceRecordIds != null ? List.copyOf(sourceRecordIds) : List.of();
        this.conflictingRecordIds = conflictingRecordIds != null ? List.copyOf(conflictingRecordIds) : List.of();
        this.confidence = confidence;
        this.overlapping = overlapping;
        this.gap = gap;
    }

    /**
     * Continued events are kept for completeness but are not shown as visible changes
     */
    public boolean isVisible() {
        return kind != ChangeKind.CONTINUED;
    }

    public boolean isAmbiguous() {
        return !conflictingRecordIds.isEmpty();
    }

    public String getDrugIdentity() {
        return drugIdentity;
    }

    public LocalDate getDate() {
        return date;
    }

    public ChangeKind getKind() {
        return kind;
    }

    public String getPreviousValue() {
        return previousValue;
    }

    public String getNewValue() {
        return newValue;
    }

    public List<String> getSourceRecordIds() {
        return sourceRecordIds;
    }

    public List<String> getConflictingRecordIds() {
        return conflictingRecordIds;
    }

    public double getConfidence() {
        return confidence;
    }

    /**
     * @return true when the new period overlaps the previous one rather than following it
     */
    public boolean isOverlapping() {
        return overlapping;
    }

    public TreatmentGap getGap() {
        return gap;
    }

    @Override
    public String toString() {
        return date + " " + drugIdentity + " " + kind.label()
                + (previousValue != null ? " from " + previousValue : "")
                + (newValue != null ? " to " + newValue : "");
    }
}
