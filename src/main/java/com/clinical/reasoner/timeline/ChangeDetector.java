package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.ChangeEvent;
import com.clinical.reasoner.model.ChangeKind;
import com.clinical.reasoner.model.Diagnostic;
import com.clinical.reasoner.model.DiagnosticKind;
import com.clinical.reasoner.model.MedicationPeriod;
import com.clinical.reasoner.model.TimelineSnapshot;
import com.clinical.reasoner.model.TreatmentGap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks each drug's periods in order and classifies the transitions between them.
 * <p>
 * The only date consulted besides the periods themselves is the snapshot's as-of date, which
 * decides whether a final explicit end has already happened. The same snapshot always yields
 * the same event sequence.
 */
public class ChangeDetector {

    private static final Logger logger = LoggerFactory.getLogger(ChangeDetector.class);

    private static final Comparator<ChangeEvent> EVENT_ORDER = Comparator
            .comparing(ChangeEvent::getDate)
            .thenComparing(ChangeEvent::getDrugIdentity);

    private final double uncertainComparisonPenalty;

    public ChangeDetector() {
        this(0.5);
    }

    /**
     * @param uncertainComparisonPenalty Confidence multiplier for transitions whose doses could
     *                                   not be compared in a common unit
     */
    public ChangeDetector(double uncertainComparisonPenalty) {
        if (uncertainComparisonPenalty < 0.0 || uncertainComparisonPenalty > 1.0) {
            throw new IllegalArgumentException("Penalty must be within [0, 1]: " + uncertainComparisonPenalty);
        }
        this.uncertainComparisonPenalty = uncertainComparisonPenalty;
    }

    /**
     * Classify every transition in the snapshot
     * @param snapshot Timeline built by {@link TimelineBuilder}
     * @return Events ordered by date then drug; per drug the order is the order of occurrence
     */
    public DetectedChanges detect(TimelineSnapshot snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("TimelineSnapshot cannot be null");
        }

        Map<String, Map<LocalDate, TreatmentGap>> gapsByDrug = new HashMap<>();
        for (TreatmentGap gap : snapshot.getTreatmentGaps()) {
            gapsByDrug.computeIfAbsent(gap.getDrugIdentity(), k -> new HashMap<>()).put(gap.getResumedOn(), gap);
        }

        List<ChangeEvent> events = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, List<MedicationPeriod>> entry : snapshot.getPeriodsByDrug().entrySet()) {
            String drug = entry.getKey();
            List<MedicationPeriod> periods = entry.getValue();
            Map<LocalDate, TreatmentGap> gaps = gapsByDrug.getOrDefault(drug, Map.of());

            // the period whose end is the furthest reached so far; null once an open period is seen
            MedicationPeriod coveringPeriod = null;
            for (int i = 0; i < periods.size(); i++) {
                MedicationPeriod period = periods.get(i);
                if (i == 0) {
                    events.add(event(drug, period.getStartDate(), ChangeKind.STARTED, null, period,
                            period.getSourceRecordIds(), period.getConfidence(), false, null));
                } else {
                    MedicationPeriod previous = periods.get(i - 1);
                    TreatmentGap gap = gaps.get(period.getStartDate());
                    if (gap != null && coveringPeriod != null && gap.getStoppedOn().equals(coveringPeriod.getEndDate())) {
                        events.add(new ChangeEvent(drug, gap.getStoppedOn(), ChangeKind.STOPPED,
                                coveringPeriod.regimenText(), null, coveringPeriod.getSourceRecordIds(), List.of(),
                                coveringPeriod.getConfidence(), false, gap));
                        events.add(event(drug, period.getStartDate(), ChangeKind.RESUMED, coveringPeriod, period,
                                period.getSourceRecordIds(), period.getConfidence(), false, gap));
                    } else {
                        events.add(classifyTransition(drug, previous, period, diagnostics));
                    }
                }
                addContinuations(drug, period, events);
                coveringPeriod = furthestReaching(coveringPeriod, period, i == 0);
            }

            // a drug is stopped only once every period has ended by the as-of date
            if (coveringPeriod != null && !coveringPeriod.getEndDate().isAfter(snapshot.getAsOfDate())) {
                events.add(new ChangeEvent(drug, coveringPeriod.getEndDate(), ChangeKind.STOPPED,
                        coveringPeriod.regimenText(), null, coveringPeriod.getSourceRecordIds(), List.of(),
                        coveringPeriod.getConfidence(), false, null));
            }
        }

        // stable sort keeps each drug's order of occurrence for events on the same date
        events.sort(EVENT_ORDER);
        diagnostics.sort(Diagnostic.ORDER);
        logger.debug("Detected {} change events across {} drugs", events.size(), snapshot.getPeriodsByDrug().size());
        return new DetectedChanges(events, diagnostics);
    }

    /**
     * @return The period reaching furthest once {@code period} is taken into account, or null
     *         when either is open-ended
     */
    private MedicationPeriod furthestReaching(MedicationPeriod covering, MedicationPeriod period, boolean first) {
        if (first) {
            return period.getEndDate() != null ? period : null;
        }
        if (covering == null || period.getEndDate() == null) {
            return null;
        }
        return period.getEndDate().isBefore(covering.getEndDate()) ? covering : period;
    }

    /**
     * Compare a period with the one immediately before it
     */
    private ChangeEvent classifyTransition(String drug, MedicationPeriod previous, MedicationPeriod period,
                                           List<Diagnostic> diagnostics) {
        boolean overlapping = previous.getEndDate() != null && period.getStartDate().isBefore(previous.getEndDate());
        double confidence = Math.min(previous.getConfidence(), period.getConfidence());
        List<String> sources = new ArrayList<>(previous.getSourceRecordIds());
        sources.addAll(period.getSourceRecordIds());
        boolean frequencyChanged = previous.getFrequency() != period.getFrequency();

        ChangeKind kind;
        if (previous.getDose().sameAmount(period.getDose())) {
            kind = frequencyChanged ? ChangeKind.FREQUENCY_CHANGED : ChangeKind.CONTINUED;
        } else {
            Optional<Integer> comparison = previous.getDose().compareAmount(period.getDose());
            if (comparison.isPresent()) {
                kind = comparison.get() < 0 ? ChangeKind.DOSE_INCREASED : ChangeKind.DOSE_DECREASED;
            } else {
                kind = classifyUncomparable(previous, period, frequencyChanged);
                confidence *= uncertainComparisonPenalty;
                diagnostics.add(new Diagnostic(DiagnosticKind.INCOMPARABLE_DOSE_UNITS, drug,
                        "Cannot compare " + previous.getDose() + " with " + period.getDose() + " on "
                                + period.getStartDate() + "; classified as " + kind.label()));
            }
        }
        return event(drug, period.getStartDate(), kind, previous, period, sources, confidence, overlapping, null);
    }

    /**
     * Doses in unrelated units are ordered by raw value; an unspecified dose gives no ordering
     */
    private ChangeKind classifyUncomparable(MedicationPeriod previous, MedicationPeriod period, boolean frequencyChanged) {
        if (previous.getDose().isSpecified() && period.getDose().isSpecified()) {
            int raw = previous.getDose().getValue().compareTo(period.getDose().getValue());
            if (raw < 0) {
                return ChangeKind.DOSE_INCREASED;
            } else if (raw > 0) {
                return ChangeKind.DOSE_DECREASED;
            }
        }
        return frequencyChanged ? ChangeKind.FREQUENCY_CHANGED : ChangeKind.CONTINUED;
    }

    /**
     * Later visits that re-recorded an unchanged regimen
     */
    private void addContinuations(String drug, MedicationPeriod period, List<ChangeEvent> events) {
        List<LocalDate> dates = period.getObservationDates();
        for (int i = 1; i < dates.size(); i++) {
            events.add(new ChangeEvent(drug, dates.get(i), ChangeKind.CONTINUED,
                    period.regimenText(), period.regimenText(), period.getSourceRecordIds(),
                    List.of(), period.getConfidence(), false, null));
        }
    }

    private ChangeEvent event(String drug, LocalDate date, ChangeKind kind, MedicationPeriod previous,
                              MedicationPeriod period, List<String> sources, double confidence,
                              boolean overlapping, TreatmentGap gap) {
        return new ChangeEvent(drug, date, kind,
                previous != null ? previous.regimenText() : null,
                period.regimenText(),
                sources, period.getConflictingRecordIds(), confidence, overlapping, gap);
    }
}
