package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.ChangeKind;
import com.clinical.reasoner.model.DiagnosticKind;
import com.clinical.reasoner.model.Frequency;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.TimelineSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ChangeDetector
 */
public class ChangeDetectorTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    private TimelineBuilder builder;
    private ChangeDetector detector;

    @BeforeEach
    public void setUp() {
        builder = new TimelineBuilder();
        detector = new ChangeDetector();
    }

    // ========== Dose and Frequency Change Tests ==========

    @Test
    public void testDetect_DoseIncrease() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "metformin", "500", "mg", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "1000", "mg", Frequency.TWICE_DAILY, LocalDate.of(2024, 3, 1))));

        List<ChangeEvent> events = changes.getEvents("metformin");

        assertEquals(2, events.size());
        assertEquals(ChangeKind.STARTED, events.get(0).getKind());
        assertEquals(LocalDate.of(2024, 1, 1), events.get(0).getDate());
        assertNull(events.get(0).getPreviousValue());
        assertEquals(ChangeKind.DOSE_INCREASED, events.get(1).getKind());
        assertEquals(LocalDate.of(2024, 3, 1), events.get(1).getDate());
        assertEquals("500mg BD", events.get(1).getPreviousValue());
        assertEquals("1000mg BD", events.get(1).getNewValue());
        assertEquals(List.of("rx-1", "rx-2"), events.get(1).getSourceRecordIds());
        assertEquals(1.0, events.get(1).getConfidence(), 1e-9);
        assertTrue(changes.getDiagnostics().isEmpty());
    }

    @Test
    public void testDetect_DoseDecrease() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "prednisolone", "40", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "prednisolone", "20", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 15))));

        assertEquals(ChangeKind.DOSE_DECREASED, changes.getEvents("prednisolone").get(1).getKind());
    }

    @Test
    public void testDetect_FrequencyChange() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "metformin", "500", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "500", "mg", Frequency.TWICE_DAILY, LocalDate.of(2024, 2, 1))));

        ChangeEvent change = changes.getEvents("metformin").get(1);
        assertEquals(ChangeKind.FREQUENCY_CHANGED, change.getKind());
        assertEquals("500mg OD", change.getPreviousValue());
        assertEquals("500mg BD", change.getNewValue());
    }

    @Test
    public void testDetect_EquivalentDoseInOtherUnitIsNotAChange() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "metformin", "1000", "mg", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "1", "g", Frequency.TWICE_DAILY, LocalDate.of(2024, 2, 1))));

        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.CONTINUED),
                changes.getEvents("metformin").stream().map(ChangeEvent::getKind).toList());
    }

    @Test
    public void testDetect_IncomparableUnitsPenalized() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "lactulose", "500", "mg", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "lactulose", "5", "ml", Frequency.TWICE_DAILY, LocalDate.of(2024, 2, 1))));

        ChangeEvent change = changes.getEvents("lactulose").get(1);
        assertEquals(ChangeKind.DOSE_DECREASED, change.getKind());
        assertEquals(0.5, change.getConfidence(), 1e-9);
        assertEquals(1, changes.getDiagnostics().size());
        assertEquals(DiagnosticKind.INCOMPARABLE_DOSE_UNITS, changes.getDiagnostics().get(0).getKind());
        assertEquals("lactulose", changes.getDiagnostics().get(0).getSubject());
    }

    // ========== Stop and Resume Tests ==========

    @Test
    public void testDetect_StopThenResume() {
        DetectedChanges changes = detect(List.of(
                MedicationRecord.builder().drugName("DrugX").dose("10", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 1, 31))
                        .sourcePrescriptionId("rx-1").build(),
                record("rx-2", "DrugX", "10", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 4, 1))));

        List<ChangeEvent> events = changes.getEvents("drugx");

        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.STOPPED, ChangeKind.RESUMED),
                events.stream().map(ChangeEvent::getKind).toList());
        assertEquals(LocalDate.of(2024, 1, 31), events.get(1).getDate());
        assertEquals(LocalDate.of(2024, 4, 1), events.get(2).getDate());
        assertNotNull(events.get(2).getGap());
        assertEquals(61, events.get(2).getGap().getDays());
        assertEquals("10mg OD", events.get(2).getPreviousValue());
    }

    @Test
    public void testDetect_FinalStopOnlyOnceItHasHappened() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("amoxicillin").dose("500", "mg")
                        .frequency(Frequency.THREE_TIMES_DAILY).observedDate(LocalDate.of(2024, 5, 1))
                        .explicitEndDate(LocalDate.of(2024, 5, 8)).sourcePrescriptionId("rx-1").build());

        List<ChangeEvent> before = detector.detect(builder.build(records, LocalDate.of(2024, 5, 5)).getSnapshot())
                .getEvents();
        List<ChangeEvent> after = detector.detect(builder.build(records, LocalDate.of(2024, 5, 8)).getSnapshot())
                .getEvents();

        assertEquals(List.of(ChangeKind.STARTED), before.stream().map(ChangeEvent::getKind).toList());
        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.STOPPED), after.stream().map(ChangeEvent::getKind).toList());
        assertEquals(LocalDate.of(2024, 5, 8), after.get(1).getDate());
    }

    @Test
    public void testDetect_NoStopWhileLongerRegimenContinues() {
        List<MedicationRecord> records = overlappingRegimens();

        List<ChangeEvent> duringLongerRegimen = detector.detect(
                builder.build(records, LocalDate.of(2024, 4, 1)).getSnapshot()).getEvents("drugx");
        List<ChangeEvent> afterEverythingEnded = detector.detect(
                builder.build(records, LocalDate.of(2024, 7, 1)).getSnapshot()).getEvents("drugx");

        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.DOSE_INCREASED),
                duringLongerRegimen.stream().map(ChangeEvent::getKind).toList());
        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.DOSE_INCREASED, ChangeKind.STOPPED),
                afterEverythingEnded.stream().map(ChangeEvent::getKind).toList());
        assertEquals(LocalDate.of(2024, 6, 1), afterEverythingEnded.get(2).getDate());
        assertEquals("500mg OD", afterEverythingEnded.get(2).getPreviousValue());
    }

    @Test
    public void testDetect_ResumeAfterOverlappingRegimensEnded() {
        List<MedicationRecord> records = new ArrayList<>(overlappingRegimens());
        records.add(record("rx-3", "DrugX", "500", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 8, 1)));

        List<ChangeEvent> events = detector.detect(
                builder.build(records, LocalDate.of(2024, 9, 1)).getSnapshot()).getEvents("drugx");

        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.DOSE_INCREASED, ChangeKind.STOPPED, ChangeKind.RESUMED),
                events.stream().map(ChangeEvent::getKind).toList());
        assertEquals(LocalDate.of(2024, 6, 1), events.get(2).getDate());
        assertEquals(LocalDate.of(2024, 8, 1), events.get(3).getDate());
        assertEquals("500mg OD", events.get(3).getPreviousValue());
    }

    // ========== Continuation Tests ==========

    @Test
    public void testDetect_ReobservationIsContinuedAndHidden() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "amlodipine", "5", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "amlodipine", "5", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 2, 1)),
                record("rx-3", "amlodipine", "5", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 3, 1))));

        assertEquals(List.of(ChangeKind.STARTED, ChangeKind.CONTINUED, ChangeKind.CONTINUED),
                changes.getEvents().stream().map(ChangeEvent::getKind).toList());
        assertEquals(1, changes.getVisibleEvents().size());
        assertEquals(ChangeKind.STARTED, changes.getVisibleEvents().get(0).getKind());
    }

    // ========== Ordering Tests ==========

    @Test
    public void testDetect_EventsOrderedByDateThenDrug() {
        DetectedChanges changes = detect(List.of(
                record("rx-1", "warfarin", "5", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "aspirin", "75", "mg", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-3", "metformin", "500", "mg", Frequency.TWICE_DAILY, LocalDate.of(2023, 12, 1))));

        List<String> drugs = changes.getEvents().stream().map(ChangeEvent::getDrugIdentity).toList();
        assertEquals(List.of("metformin", "aspirin", "warfarin"), drugs);
    }

    @Test
    public void testDetect_ConflictCarriedOnEvent() {
        LocalDate day = LocalDate.of(2024, 1, 1);
        DetectedChanges changes = detect(List.of(
                record("rx-a", "metformin", "500", "mg", Frequency.TWICE_DAILY, day),
                record("rx-b", "metformin", "850", "mg", Frequency.TWICE_DAILY, day)));

        ChangeEvent started = changes.getEvents().get(0);
        assertTrue(started.isAmbiguous());
        assertEquals(List.of("rx-a"), started.getConflictingRecordIds());
        assertEquals(0.5, started.getConfidence(), 1e-9);
    }

    @Test
    public void testDetect_RejectsNullSnapshot() {
        assertThrows(IllegalArgumentException.class, () -> detector.detect(null));
        assertThrows(IllegalArgumentException.class, () -> new ChangeDetector(2.0));
    }

    private static List<MedicationRecord> overlappingRegimens() {
        return List.of(
                MedicationRecord.builder().drugName("DrugX").dose("500", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 6, 1))
                        .sourcePrescriptionId("rx-1").build(),
                MedicationRecord.builder().drugName("DrugX").dose("1000", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 2, 1)).explicitEndDate(LocalDate.of(2024, 3, 1))
                        .sourcePrescriptionId("rx-2").build());
    }

    private DetectedChanges detect(List<MedicationRecord> records) {
        TimelineSnapshot snapshot = builder.build(records, AS_OF).getSnapshot();
        return detector.detect(snapshot);
    }

    private static MedicationRecord record(String id, String drug, String value, String unit,
                                           Frequency frequency, LocalDate date) {
        return MedicationRecord.builder()
                .drugName(drug)
                .dose(value, unit)
                .frequency(frequency)
                .observedDate(date)
                .sourcePrescriptionId(id)
                .build();
    }
}
