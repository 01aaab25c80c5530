package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.TimelineSnapshot;

import java.util.List;

/**
 * Output of {@link TimelineBuilder}: the snapshot plus everything that could not be resolved
 * while building it
 */
public final class BuiltTimeline {

    private final TimelineSnapshot snapshot;
    private final List<Diagnostic> diagnostics;
    private final List<MedicationRecord> acceptedRecords;

    public BuiltTimeline(TimelineSnapshot snapshot, List<Diagnostic> diagnostics, List<MedicationRecord> acceptedRecords) {
        this.snapshot = snapshot;
        this.diagnostics = List.copyOf(diagnostics);
        this.acceptedRecords = List.copyOf(acceptedRecords);
    }

    public TimelineSnapshot getSnapshot() {
        return snapshot;
    }

    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }

    /**
     * @return Records that passed validation, in input order; rejected records appear only as diagnostics
     */
    public List<MedicationRecord> getAcceptedRecords() {
        return acceptedRecords;
    }

    public int getAcceptedRecordCount() {
        return acceptedRecords.size();
    }
}
