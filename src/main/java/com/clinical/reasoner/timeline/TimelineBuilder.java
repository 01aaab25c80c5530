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
import com.clinical.reasoner.model.Route;
import com.clinical.reasoner.model.TimelineSnapshot;
import com.clinical.reasoner.model.TreatmentGap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Turns an unordered set of medication records into per-drug sequences of medication periods.
 * <p>
 * Records are grouped by drug identity and sorted internally, so the result does not depend on
 * input order. Same-regimen records that are contiguous within the continuity window merge into
 * one period; a regimen change closes the running period at the new record's start. Explicit end
 * dates always close a period. Genuinely overlapping periods with different regimens are both
 * kept and reported.
 */
public class TimelineBuilder {

    private static final Logger logger = LoggerFactory.getLogger(TimelineBuilder.class);

    private static final String UNIDENTIFIED_PREFIX = "unidentified:";

    /**
     * Orders same-day records from least to most recently recorded. Records without a recording
     * instant count as the oldest; source id breaks remaining ties.
     */
    static final Comparator<MedicationRecord> RECENCY = Comparator
            .comparing(MedicationRecord::getRecordedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(TimelineBuilder::sourceId);

    private final int continuityWindowDays;
    private final boolean inferStopFromVisits;
    private final double sameDayConflictPenalty;
    private final int significantOverlapDays;

    public TimelineBuilder() {
        this(0, false, 0.5, 7);
    }

    /**
     * @param continuityWindowDays Largest gap in days between an explicit end and the next
     *                             same-regimen record that still counts as continuous
     * @param inferStopFromVisits Close an open period at the first later visit that does not record the drug
     * @param sameDayConflictPenalty Confidence multiplier for periods whose start date had conflicting records
     * @param significantOverlapDays Concurrent use of at least this many days is flagged significant
     */
    public TimelineBuilder(int continuityWindowDays, boolean inferStopFromVisits,
                           double sameDayConflictPenalty, int significantOverlapDays) {
        if (continuityWindowDays < 0) {
            throw new IllegalArgumentException("Continuity window cannot be negative: " + continuityWindowDays);
        }
        if (sameDayConflictPenalty < 0.0 || sameDayConflictPenalty > 1.0) {
            throw new IllegalArgumentException("Same-day conflict penalty must be within [0, 1]: " + sameDayConflictPenalty);
        }
        this.continuityWindowDays = continuityWindowDays;
        this.inferStopFromVisits = inferStopFromVisits;
        this.sameDayConflictPenalty = sameDayConflictPenalty;
        this.significantOverlapDays = significantOverlapDays;
    }

    /**
     * Build the timeline for one patient
     * @param records Medication records in any order
     * @param asOfDate Date the active subset is computed for
     * @return Snapshot plus diagnostics for rejected or ambiguous records
     */
    public BuiltTimeline build(Collection<MedicationRecord> records, LocalDate asOfDate) {
        if (records == null) {
            throw new IllegalArgumentException("Medication records cannot be null");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date cannot be null");
        }

        List<Diagnostic> diagnostics = new ArrayList<>();
        Map<String, List<MedicationRecord>> recordsByDrug = new TreeMap<>();
        TreeSet<LocalDate> visitDates = new TreeSet<>();
        List<MedicationRecord> accepted = new ArrayList<>();

        for (MedicationRecord record : records) {
            if (record == null) {
                diagnostics.add(new Diagnostic(DiagnosticKind.INVALID_RECORD, "", "Null medication record"));
                continue;
            }
            String problem = validateRecord(record);
            if (problem != null) {
                logger.warn("Skipping invalid medication record {}: {}", sourceId(record), problem);
                diagnostics.add(new Diagnostic(DiagnosticKind.INVALID_RECORD, sourceId(record), problem));
                continue;
            }
            recordsByDrug.computeIfAbsent(record.getDrugIdentity(), k -> new ArrayList<>()).add(record);
            visitDates.add(record.getVisitDate());
            accepted.add(record);
        }

        Map<String, List<MedicationPeriod>> periodsByDrug = new TreeMap<>();
        List<TreatmentGap> gaps = new ArrayList<>();
        List<PeriodOverlap> overlaps = new ArrayList<>();

        for (Map.Entry<String, List<MedicationRecord>> entry : recordsByDrug.entrySet()) {
            String drug = entry.getKey();
            List<DayEntry> days = collapseSameDay(drug, entry.getValue(), diagnostics);
            List<MedicationPeriod> periods = mergeIntoPeriods(drug, days, overlaps, diagnostics);
            if (inferStopFromVisits) {
                periods = inferStopFromVisits(drug, periods, entry.getValue(), visitDates);
            }
            gaps.addAll(findGaps(drug, periods));
            periodsByDrug.put(drug, periods);
        }

        List<ConcurrentUse> concurrentUse = findConcurrentUse(periodsByDrug, asOfDate);
        diagnostics.sort(Diagnostic.ORDER);

        TimelineSnapshot snapshot = new TimelineSnapshot(asOfDate, periodsByDrug, gaps, overlaps, concurrentUse);
        logger.debug("Built timeline: {} records accepted, {} drugs, {} active on {}",
                accepted.size(), periodsByDrug.size(), snapshot.getActiveDrugs().size(), asOfDate);
        return new BuiltTimeline(snapshot, diagnostics, accepted);
    }

    /**
     * @return Reason the record cannot be used, or null when it is valid
     */
    private String validateRecord(MedicationRecord record) {
        if (record.getDrugIdentity() == null) {
            return "Missing drug name";
        }
        if (record.getObservedDate() == null) {
            return "Missing observed date";
        }
        if (record.getExplicitEndDate() != null && record.getExplicitEndDate().isBefore(record.getObservedDate())) {
            return "End date " + record.getExplicitEndDate() + " is before start date " + record.getObservedDate();
        }
        double confidence = record.getExtractionConfidence();
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            return "Extraction confidence " + confidence + " is outside [0, 1]";
        }
        return null;
    }

    /**
     * Reduce each drug's records to one entry per observed date. When same-day records disagree
     * on the regimen, the most recently recorded one wins and the others are kept as conflicts.
     */
    private List<DayEntry> collapseSameDay(String drug, List<MedicationRecord> records, List<Diagnostic> diagnostics) {
        TreeMap<LocalDate, List<MedicationRecord>> byDate = new TreeMap<>();
        for (MedicationRecord record : records) {
            byDate.computeIfAbsent(record.getObservedDate(), k -> new ArrayList<>()).add(record);
        }

        List<DayEntry> days = new ArrayList<>();
        for (Map.Entry<LocalDate, List<MedicationRecord>> entry : byDate.entrySet()) {
            List<MedicationRecord> sameDay = new ArrayList<>(entry.getValue());
            sameDay.sort(RECENCY);
            MedicationRecord winner = sameDay.get(sameDay.size() - 1);

            TreeSet<String> agreeing = new TreeSet<>();
            TreeSet<String> conflicting = new TreeSet<>();
            double confidence = 1.0;
            for (MedicationRecord record : sameDay) {
                if (record.sameRegimen(winner)) {
                    agreeing.add(sourceId(record));
                    confidence = Math.min(confidence, record.getExtractionConfidence());
                } else {
                    conflicting.add(sourceId(record));
                }
            }

            if (!conflicting.isEmpty()) {
                confidence *= sameDayConflictPenalty;
                diagnostics.add(new Diagnostic(DiagnosticKind.AMBIGUOUS_DATE_ORDERING, drug,
                        sameDay.size() + " records on " + entry.getKey() + " disagree on the regimen; using "
                                + sourceId(winner) + " (" + winner.regimenText() + ") over " + conflicting));
            }
            days.add(new DayEntry(entry.getKey(), winner, new ArrayList<>(agreeing), new ArrayList<>(conflicting),
                    confidence));
        }
        return days;
    }

    private List<MedicationPeriod> mergeIntoPeriods(String drug, List<DayEntry> days,
                                                    List<PeriodOverlap> overlaps, List<Diagnostic> diagnostics) {
        List<MedicationPeriod> periods = new ArrayList<>();
        PeriodDraft current = null;

        for (DayEntry day : days) {
            if (current == null) {
                current = new PeriodDraft(day);
            } else if (current.end == null) {
                if (current.sameRegimen(day)) {
                    current.absorb(day);
                } else {
                    current.closeAt(day.date, PeriodEnd.REGIMEN_CHANGE);
                    finish(drug, current, periods, overlaps, diagnostics);
                    current = new PeriodDraft(day);
                }
            } else if (day.date.isBefore(current.end)) {
                if (current.sameRegimen(day)) {
                    current.absorb(day);
                } else {
                    MedicationPeriod first = finish(drug, current, periods, overlaps, diagnostics);
                    current = new PeriodDraft(day);
                    current.overlapsWith = first;
                }
            } else {
                long gap = ChronoUnit.DAYS.between(current.end, day.date);
                if (gap <= continuityWindowDays && current.sameRegimen(day)) {
                    current.absorb(day);
                } else {
                    finish(drug, current, periods, overlaps, diagnostics);
                    current = new PeriodDraft(day);
                }
            }
        }
        if (current != null) {
            finish(drug, current, periods, overlaps, diagnostics);
        }
        return periods;
    }

    private MedicationPeriod finish(String drug, PeriodDraft draft, List<MedicationPeriod> periods,
                                    List<PeriodOverlap> overlaps, List<Diagnostic> diagnostics) {
        MedicationPeriod period = draft.toPeriod(drug);
        periods.add(period);
        if (draft.overlapsWith != null) {
            MedicationPeriod first = draft.overlapsWith;
            LocalDate overlapEnd = period.getEndDate() != null && period.getEndDate().isBefore(first.getEndDate())
                    ? period.getEndDate()
                    : first.getEndDate();
            overlaps.add(new PeriodOverlap(drug, first, period, period.getStartDate(), overlapEnd));
            diagnostics.add(new Diagnostic(DiagnosticKind.PERIOD_OVERLAP, drug,
                    "Period " + first + " overlaps " + period + " from " + period.getStartDate() + " to " + overlapEnd));
        }
        return period;
    }

    /**
     * Close the drug's open period at the first later visit on which the drug was not recorded
     */
    private List<MedicationPeriod> inferStopFromVisits(String drug, List<MedicationPeriod> periods,
                                                       List<MedicationRecord> records,
                                                       NavigableSet<LocalDate> visitDates) {
        if (periods.isEmpty()) {
            return periods;
        }
        MedicationPeriod last = periods.get(periods.size() - 1);
        if (!last.isOpen()) {
            return periods;
        }
        LocalDate lastSeen = last.getStartDate();
        for (MedicationRecord record : records) {
            if (record.getVisitDate().isAfter(lastSeen)) {
                lastSeen = record.getVisitDate();
            }
        }
        LocalDate absentVisit = visitDates.higher(lastSeen);
        if (absentVisit == null) {
            return periods;
        }
        logger.debug("Inferring stop of {} at visit {} where it was not recorded", drug, absentVisit);
        List<MedicationPeriod> adjusted = new ArrayList<>(periods.subList(0, periods.size() - 1));
        adjusted.add(new MedicationPeriod(drug, last.getStartDate(), absentVisit, PeriodEnd.VISIT_ABSENCE,
                last.getDose(), last.getFrequency(), last.getRoute(), last.getSourceRecordIds(),
                last.getConflictingRecordIds(), last.getObservationDates(), last.getConfidence()));
        return adjusted;
    }

    private List<TreatmentGap> findGaps(String drug, List<MedicationPeriod> periods) {
        List<TreatmentGap> gaps = new ArrayList<>();
        // furthest end covered so far; null once an open period has been seen
        LocalDate coveredUntil = periods.get(0).getEndDate();
        for (int i = 1; i < periods.size(); i++) {
            MedicationPeriod next = periods.get(i);
            if (coveredUntil == null) {
                break;
            }
            long days = ChronoUnit.DAYS.between(coveredUntil, next.getStartDate());
            if (days > continuityWindowDays) {
                gaps.add(new TreatmentGap(drug, coveredUntil, next.getStartDate(), days));
            }
            coveredUntil = latestEnd(coveredUntil, next.getEndDate());
        }
        return gaps;
    }

    /**
     * @return The later of two ends, or null when either is open
     */
    private static LocalDate latestEnd(LocalDate first, LocalDate second) {
        if (first == null || second == null) {
            return null;
        }
        return first.isAfter(second) ? first : second;
    }

    /**
     * Date ranges over which two different drugs were both taken. Ends are exclusive and capped
     * at the day after the as-of date.
     */
    private List<ConcurrentUse> findConcurrentUse(Map<String, List<MedicationPeriod>> periodsByDrug, LocalDate asOfDate) {
        LocalDate cap = asOfDate.plusDays(1);
        List<String> drugs = new ArrayList<>(periodsByDrug.keySet());
        List<ConcurrentUse> result = new ArrayList<>();

        for (int i = 0; i < drugs.size(); i++) {
            for (int j = i + 1; j < drugs.size(); j++) {
                for (MedicationPeriod a : periodsByDrug.get(drugs.get(i))) {
                    for (MedicationPeriod b : periodsByDrug.get(drugs.get(j))) {
                        LocalDate start = later(a.getStartDate(), b.getStartDate());
                        LocalDate end = earlier(cappedEnd(a, cap), cappedEnd(b, cap));
                        if (start.isBefore(end)) {
                            long days = ChronoUnit.DAYS.between(start, end);
                            result.add(new ConcurrentUse(drugs.get(i), drugs.get(j), start, end, days,
                                    days >= significantOverlapDays));
                        }
                    }
                }
            }
        }
        return result;
    }

    private static LocalDate cappedEnd(MedicationPeriod period, LocalDate cap) {
        LocalDate end = period.getEndDate();
        return end == null || end.isAfter(cap) ? cap : end;
    }

    private static LocalDate later(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate earlier(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }

    /**
     * Source prescription id, or a deterministic placeholder when the record has none
     */
    static String sourceId(MedicationRecord record) {
        String id = record.getSourcePrescriptionId();
        if (id != null && !id.isBlank()) {
            return id;
        }
        return UNIDENTIFIED_PREFIX + record.getDrugIdentity() + "@" + record.getObservedDate();
    }

    /**
     * All records of one drug observed on one date, reduced to the winning regimen
     */
    private static final class DayEntry {
        private final LocalDate date;
        private final MedicationRecord winner;
        private final List<String> sourceIds;
        private final List<String> conflictingIds;
        private final double confidence;

        DayEntry(LocalDate date, MedicationRecord winner, List<String> sourceIds, List<String> conflictingIds,
                 double confidence) {
            this.date = date;
            this.winner = winner;
            this.sourceIds = sourceIds;
            this.conflictingIds = conflictingIds;
            this.confidence = confidence;
        }
    }

    /**
     * Mutable period under construction
     */
    private static final class PeriodDraft {
        private final LocalDate start;
        private final Dose dose;
        private final Frequency frequency;
        private final Route route;
        private final MedicationRecord firstRecord;
        private final TreeSet<String> sourceIds = new TreeSet<>();
        private final TreeSet<String> conflictingIds = new TreeSet<>();
        private final List<LocalDate> observationDates = new ArrayList<>();
        private LocalDate end;
        private PeriodEnd endKind;
        private double confidence;
        private MedicationPeriod overlapsWith;

        PeriodDraft(DayEntry day) {
            this.start = day.date;
            this.firstRecord = day.winner;
            this.dose = day.winner.getDose();
            this.frequency = day.winner.getFrequency();
            this.route = day.winner.getRoute();
            this.end = day.winner.getExplicitEndDate();
            this.endKind = end == null ? PeriodEnd.OPEN : PeriodEnd.EXPLICIT;
            this.confidence = day.confidence;
            this.sourceIds.addAll(day.sourceIds);
            this.conflictingIds.addAll(day.conflictingIds);
            this.observationDates.add(day.date);
        }

        boolean sameRegimen(DayEntry day) {
            return firstRecord.sameRegimen(day.winner);
        }

        void absorb(DayEntry day) {
            sourceIds.addAll(day.sourceIds);
            conflictingIds.addAll(day.conflictingIds);
            observationDates.add(day.date);
            confidence = Math.min(confidence, day.confidence);
            LocalDate dayEnd = day.winner.getExplicitEndDate();
            if (dayEnd == null) {
                end = null;
                endKind = PeriodEnd.OPEN;
            } else if (end == null || dayEnd.isAfter(end)) {
                end = dayEnd;
                endKind = PeriodEnd.EXPLICIT;
            }
        }

        void closeAt(LocalDate date, PeriodEnd kind) {
            this.end = date;
            this.endKind = kind;
        }

        MedicationPeriod toPeriod(String drug) {
            return new MedicationPeriod(drug, start, end, endKind, dose, frequency, route,
                    new ArrayList<>(sourceIds), new ArrayList<>(conflictingIds), observationDates, confidence);
        }
    }
}
