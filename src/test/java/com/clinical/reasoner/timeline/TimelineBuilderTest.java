package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.ConcurrentUse;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.DiagnosticKind;
import com.clinical.reasoner.model.Dose;
import com.clinical.reasoner.model.Frequency;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.MedicationRecord;
import com.clinical.reasoner.model.PeriodEnd;
import com.clinical.reasoner.model.PeriodOverlap;
import com.clinical.reasoner.model.TimelineSnapshot;
import com.clinical.reasoner.model.TreatmentGap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimelineBuilder
 */
public class TimelineBuilderTest {

    private static final LocalDate AS_OF = LocalDate.of(2024, 6, 1);

    private TimelineBuilder builder;

    @BeforeEach
    public void setUp() {
        builder = new TimelineBuilder();
    }

    // ========== Period Construction Tests ==========

    @Test
    public void testBuild_DoseChangeSplitsPeriods() {
        List<MedicationRecord> records = List.of(
                record("rx-1", "Metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "1000", Frequency.TWICE_DAILY, LocalDate.of(2024, 3, 1)));

        TimelineSnapshot snapshot = builder.build(records, AS_OF).getSnapshot();
        List<MedicationPeriod> periods = snapshot.getPeriods("metformin");

        assertEquals(2, periods.size());
        assertEquals(LocalDate.of(2024, 1, 1), periods.get(0).getStartDate());
        assertEquals(LocalDate.of(2024, 3, 1), periods.get(0).getEndDate());
        assertEquals(PeriodEnd.REGIMEN_CHANGE, periods.get(0).getEndKind());
        assertEquals(Dose.of("500", "mg"), periods.get(0).getDose());
        assertEquals(LocalDate.of(2024, 3, 1), periods.get(1).getStartDate());
        assertTrue(periods.get(1).isOpen());
        assertEquals(List.of("rx-2"), periods.get(1).getSourceRecordIds());
        assertTrue(snapshot.getTreatmentGaps().isEmpty());
        assertEquals(List.of("metformin"), List.copyOf(snapshot.getActiveDrugs()));
    }

    @Test
    public void testBuild_SameRegimenMergesIntoOnePeriod() {
        List<MedicationRecord> records = List.of(
                record("rx-1", "amlodipine", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "amlodipine", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 2, 1)),
                record("rx-3", "amlodipine", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 3, 1)));

        List<MedicationPeriod> periods = builder.build(records, AS_OF).getSnapshot().getPeriods("amlodipine");

        assertEquals(1, periods.size());
        assertEquals(List.of("rx-1", "rx-2", "rx-3"), periods.get(0).getSourceRecordIds());
        assertEquals(3, periods.get(0).getObservationDates().size());
        assertTrue(periods.get(0).isOpen());
    }

    @Test
    public void testBuild_ExplicitEndThenResumeGivesGap() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("DrugX").dose("10", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 1, 31))
                        .sourcePrescriptionId("rx-1").build(),
                record("rx-2", "DrugX", "10", Frequency.ONCE_DAILY, LocalDate.of(2024, 4, 1)));

        TimelineSnapshot snapshot = builder.build(records, AS_OF).getSnapshot();

        assertEquals(2, snapshot.getPeriods("drugx").size());
        assertEquals(PeriodEnd.EXPLICIT, snapshot.getPeriods("drugx").get(0).getEndKind());
        assertEquals(1, snapshot.getTreatmentGaps().size());
        TreatmentGap gap = snapshot.getTreatmentGaps().get(0);
        assertEquals(LocalDate.of(2024, 1, 31), gap.getStoppedOn());
        assertEquals(LocalDate.of(2024, 4, 1), gap.getResumedOn());
        assertEquals(61, gap.getDays());
    }

    @Test
    public void testBuild_ContinuityWindowBridgesShortGap() {
        TimelineBuilder windowed = new TimelineBuilder(7, false, 0.5, 7);
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("atorvastatin").dose("20", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 1, 31))
                        .sourcePrescriptionId("rx-1").build(),
                record("rx-2", "atorvastatin", "20", Frequency.ONCE_DAILY, LocalDate.of(2024, 2, 5)));

        TimelineSnapshot snapshot = windowed.build(records, AS_OF).getSnapshot();

        assertEquals(1, snapshot.getPeriods("atorvastatin").size());
        assertTrue(snapshot.getPeriods("atorvastatin").get(0).isOpen());
        assertTrue(snapshot.getTreatmentGaps().isEmpty());
    }

    @Test
    public void testBuild_EndedPeriodIsNotActive() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("amoxicillin").dose("500", "mg")
                        .frequency(Frequency.THREE_TIMES_DAILY).observedDate(LocalDate.of(2024, 5, 1))
                        .explicitEndDate(LocalDate.of(2024, 5, 8)).sourcePrescriptionId("rx-1").build());

        TimelineSnapshot snapshot = builder.build(records, AS_OF).getSnapshot();

        assertEquals(1, snapshot.getAllPeriods().size());
        assertTrue(snapshot.getActiveDrugs().isEmpty());
        assertTrue(builder.build(records, LocalDate.of(2024, 5, 7)).getSnapshot().getActiveDrugs().contains("amoxicillin"));
        assertFalse(builder.build(records, LocalDate.of(2024, 5, 8)).getSnapshot().getActiveDrugs().contains("amoxicillin"));
    }

    // ========== Same-Day Conflict Tests ==========

    @Test
    public void testBuild_SameDayConflictUsesMostRecentlyRecorded() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("metformin").dose("1000", "mg").frequency(Frequency.TWICE_DAILY)
                        .observedDate(day).sourcePrescriptionId("rx-late")
                        .recordedAt(Instant.parse("2024-03-01T15:00:00Z")).build(),
                MedicationRecord.builder().drugName("metformin").dose("500", "mg").frequency(Frequency.TWICE_DAILY)
                        .observedDate(day).sourcePrescriptionId("rx-early")
                        .recordedAt(Instant.parse("2024-03-01T09:00:00Z")).build());

        BuiltTimeline timeline = builder.build(records, AS_OF);
        List<MedicationPeriod> periods = timeline.getSnapshot().getPeriods("metformin");

        assertEquals(1, periods.size());
        assertEquals(Dose.of("1000", "mg"), periods.get(0).getDose());
        assertEquals(List.of("rx-late"), periods.get(0).getSourceRecordIds());
        assertEquals(List.of("rx-early"), periods.get(0).getConflictingRecordIds());
        assertTrue(periods.get(0).isAmbiguous());
        assertEquals(0.5, periods.get(0).getConfidence(), 1e-9);
        assertEquals(1, timeline.getDiagnostics().size());
        assertEquals(DiagnosticKind.AMBIGUOUS_DATE_ORDERING, timeline.getDiagnostics().get(0).getKind());
    }

    @Test
    public void testBuild_SameDayAgreementIsNotAConflict() {
        LocalDate day = LocalDate.of(2024, 3, 1);
        List<MedicationRecord> records = List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, day),
                MedicationRecord.builder().drugName("metformin").dose("0.5", "g").frequency(Frequency.TWICE_DAILY)
                        .observedDate(day).sourcePrescriptionId("rx-2").extractionConfidence(0.8).build());

        BuiltTimeline timeline = builder.build(records, AS_OF);
        MedicationPeriod period = timeline.getSnapshot().getPeriods("metformin").get(0);

        assertFalse(period.isAmbiguous());
        assertEquals(List.of("rx-1", "rx-2"), period.getSourceRecordIds());
        assertEquals(0.8, period.getConfidence(), 1e-9);
        assertTrue(timeline.getDiagnostics().isEmpty());
    }

    // ========== Invalid Record Tests ==========

    @Test
    public void testBuild_InvalidRecordsReportedAndSkipped() {
        List<MedicationRecord> records = Arrays.asList(
                MedicationRecord.builder().dose("5", "mg").observedDate(LocalDate.of(2024, 1, 1))
                        .sourcePrescriptionId("no-name").build(),
                MedicationRecord.builder().drugName("aspirin").sourcePrescriptionId("no-date").build(),
                MedicationRecord.builder().drugName("aspirin").observedDate(LocalDate.of(2024, 2, 1))
                        .explicitEndDate(LocalDate.of(2024, 1, 1)).sourcePrescriptionId("backwards").build(),
                MedicationRecord.builder().drugName("aspirin").observedDate(LocalDate.of(2024, 2, 1))
                        .extractionConfidence(1.5).sourcePrescriptionId("bad-confidence").build(),
                null,
                record("rx-ok", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 2, 1)));

        BuiltTimeline timeline = builder.build(records, AS_OF);

        assertEquals(1, timeline.getAcceptedRecordCount());
        assertEquals("rx-ok", timeline.getAcceptedRecords().get(0).getSourcePrescriptionId());
        assertEquals(5, timeline.getDiagnostics().size());
        assertTrue(timeline.getDiagnostics().stream().allMatch(d -> d.getKind() == DiagnosticKind.INVALID_RECORD));
        List<String> subjects = timeline.getDiagnostics().stream().map(Diagnostic::getSubject).toList();
        assertTrue(subjects.containsAll(List.of("no-name", "no-date", "backwards", "bad-confidence", "")));
        assertEquals(1, timeline.getSnapshot().getAllPeriods().size());
    }

    @Test
    public void testBuild_EmptyInput() {
        BuiltTimeline timeline = builder.build(List.of(), AS_OF);

        assertTrue(timeline.getSnapshot().getPeriodsByDrug().isEmpty());
        assertTrue(timeline.getDiagnostics().isEmpty());
    }

    @Test
    public void testBuild_RejectsNullArguments() {
        assertThrows(IllegalArgumentException.class, () -> builder.build(null, AS_OF));
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(), null));
        assertThrows(IllegalArgumentException.class, () -> new TimelineBuilder(-1, false, 0.5, 7));
        assertThrows(IllegalArgumentException.class, () -> new TimelineBuilder(0, false, 1.5, 7));
    }

    // ========== Determinism Tests ==========

    @Test
    public void testBuild_InputOrderDoesNotMatter() {
        List<MedicationRecord> records = new ArrayList<>(List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "metformin", "1000", Frequency.TWICE_DAILY, LocalDate.of(2024, 3, 1)),
                record("rx-3", "warfarin", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 2, 1)),
                record("rx-4", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 4, 1)),
                record("rx-5", "metformin", "1000", Frequency.TWICE_DAILY, LocalDate.of(2024, 5, 1))));
        String expected = describe(builder.build(records, AS_OF).getSnapshot());

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(records, random);
            assertEquals(expected, describe(builder.build(records, AS_OF).getSnapshot()));
        }
    }

    // ========== Overlap and Concurrency Tests ==========

    @Test
    public void testBuild_OverlappingRegimensKeptAndReported() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("prednisolone").dose("10", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 3, 31))
                        .sourcePrescriptionId("rx-1").build(),
                MedicationRecord.builder().drugName("prednisolone").dose("20", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 2, 1)).explicitEndDate(LocalDate.of(2024, 4, 30))
                        .sourcePrescriptionId("rx-2").build());

        BuiltTimeline timeline = builder.build(records, LocalDate.of(2024, 3, 15));

        assertEquals(2, timeline.getSnapshot().getPeriods("prednisolone").size());
        assertEquals(1, timeline.getSnapshot().getOverlaps().size());
        PeriodOverlap overlap = timeline.getSnapshot().getOverlaps().get(0);
        assertEquals(LocalDate.of(2024, 2, 1), overlap.getOverlapStart());
        assertEquals(LocalDate.of(2024, 3, 31), overlap.getOverlapEnd());
        assertTrue(timeline.getDiagnostics().stream().anyMatch(d -> d.getKind() == DiagnosticKind.PERIOD_OVERLAP));
        assertEquals(2, timeline.getSnapshot().getActivePeriods().size());
    }

    @Test
    public void testBuild_ShorterOverlappingRegimenDoesNotOpenGap() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("DrugX").dose("500", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 6, 1))
                        .sourcePrescriptionId("rx-1").build(),
                MedicationRecord.builder().drugName("DrugX").dose("1000", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 2, 1)).explicitEndDate(LocalDate.of(2024, 3, 1))
                        .sourcePrescriptionId("rx-2").build(),
                record("rx-3", "DrugX", "500", Frequency.ONCE_DAILY, LocalDate.of(2024, 4, 1)));

        TimelineSnapshot snapshot = builder.build(records, LocalDate.of(2024, 4, 1)).getSnapshot();

        assertEquals(3, snapshot.getPeriods("drugx").size());
        assertTrue(snapshot.getTreatmentGaps().isEmpty());
        assertTrue(snapshot.getActiveDrugs().contains("drugx"));
    }

    @Test
    public void testBuild_GapMeasuredFromFurthestEnd() {
        List<MedicationRecord> records = List.of(
                MedicationRecord.builder().drugName("DrugX").dose("500", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 1, 1)).explicitEndDate(LocalDate.of(2024, 6, 1))
                        .sourcePrescriptionId("rx-1").build(),
                MedicationRecord.builder().drugName("DrugX").dose("1000", "mg").frequency(Frequency.ONCE_DAILY)
                        .observedDate(LocalDate.of(2024, 2, 1)).explicitEndDate(LocalDate.of(2024, 3, 1))
                        .sourcePrescriptionId("rx-2").build(),
                record("rx-3", "DrugX", "500", Frequency.ONCE_DAILY, LocalDate.of(2024, 8, 1)));

        List<TreatmentGap> gaps = builder.build(records, LocalDate.of(2024, 9, 1)).getSnapshot().getTreatmentGaps();

        assertEquals(1, gaps.size());
        assertEquals(LocalDate.of(2024, 6, 1), gaps.get(0).getStoppedOn());
        assertEquals(LocalDate.of(2024, 8, 1), gaps.get(0).getResumedOn());
        assertEquals(61, gaps.get(0).getDays());
    }

    @Test
    public void testBuild_ConcurrentUseAcrossDrugs() {
        List<MedicationRecord> records = List.of(
                record("rx-1", "warfarin", "5", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 5, 20)),
                MedicationRecord.builder().drugName("ibuprofen").dose("400", "mg").frequency(Frequency.AS_NEEDED)
                        .observedDate(LocalDate.of(2024, 5, 29)).explicitEndDate(LocalDate.of(2024, 5, 31))
                        .sourcePrescriptionId("rx-3").build());

        List<ConcurrentUse> concurrent = builder.build(records, AS_OF).getSnapshot().getConcurrentUse();

        ConcurrentUse aspirinWarfarin = concurrent.stream()
                .filter(c -> c.getDrugA().equals("aspirin") && c.getDrugB().equals("warfarin"))
                .findFirst().orElseThrow();
        assertEquals(LocalDate.of(2024, 5, 20), aspirinWarfarin.getStart());
        assertEquals(13, aspirinWarfarin.getDays());
        assertTrue(aspirinWarfarin.isSignificant());

        ConcurrentUse ibuprofenWarfarin = concurrent.stream()
                .filter(c -> c.getDrugA().equals("ibuprofen") && c.getDrugB().equals("warfarin"))
                .findFirst().orElseThrow();
        assertEquals(2, ibuprofenWarfarin.getDays());
        assertFalse(ibuprofenWarfarin.isSignificant());
    }

    // ========== Visit Inference Tests ==========

    @Test
    public void testBuild_InferStopFromLaterVisit() {
        TimelineBuilder inferring = new TimelineBuilder(0, true, 0.5, 7);
        List<MedicationRecord> records = List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-2", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-3", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 3, 1)));

        TimelineSnapshot snapshot = inferring.build(records, AS_OF).getSnapshot();

        MedicationPeriod metformin = snapshot.getPeriods("metformin").get(0);
        assertEquals(LocalDate.of(2024, 3, 1), metformin.getEndDate());
        assertEquals(PeriodEnd.VISIT_ABSENCE, metformin.getEndKind());
        assertTrue(snapshot.getPeriods("aspirin").get(0).isOpen());
        assertEquals(List.of("aspirin"), List.copyOf(snapshot.getActiveDrugs()));
    }

    @Test
    public void testBuild_WithoutVisitInferenceStaysOpen() {
        List<MedicationRecord> records = List.of(
                record("rx-1", "metformin", "500", Frequency.TWICE_DAILY, LocalDate.of(2024, 1, 1)),
                record("rx-3", "aspirin", "75", Frequency.ONCE_DAILY, LocalDate.of(2024, 3, 1)));

        TimelineSnapshot snapshot = builder.build(records, AS_OF).getSnapshot();

        assertTrue(snapshot.getPeriods("metformin").get(0).isOpen());
    }

    private static String describe(TimelineSnapshot snapshot) {
        StringBuilder sb = new StringBuilder();
        snapshot.getAllPeriods().forEach(p -> sb.append(p).append(p.getSourceRecordIds()).append('\n'));
        snapshot.getTreatmentGaps().forEach(g -> sb.append(g).append('\n'));
        snapshot.getConcurrentUse().forEach(c -> sb.append(c.getDrugA()).append(c.getDrugB()).append(c.getDays()));
        return sb.toString();
    }

    private static MedicationRecord record(String id, String drug, String mg, Frequency frequency, LocalDate date) {
        return MedicationRecord.builder()
                .drugName(drug)
                .dose(mg, "mg")
                .frequency(frequency)
                .observedDate(date)
                .sourcePrescriptionId(id)
                .build();
    }
}
