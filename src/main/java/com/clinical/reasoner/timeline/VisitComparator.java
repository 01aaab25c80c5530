package com.clinical.reasoner.timeline;

import com.clinical.reasoner.model.MedicationRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Compares the prescriptions recorded at two visits.
 * <p>
 * Unlike {@link ChangeDetector}, which follows periods, this looks only at what each visit
 * recorded. A drug left off the later visit is reported as discontinued even when stop
 * inference from visits is switched off.
 */
public class VisitComparator {

    private static final Logger logger = LoggerFactory.getLogger(VisitComparator.class);

    /**
     * Compare the two latest visits on or before the as-of date
     * @param records Validated medication records
     * @param asOfDate Visits after this date are ignored
     * @return The comparison, or empty when fewer than two visits are on record
     */
    public Optional<VisitComparison> compareLatestVisits(Collection<MedicationRecord> records, LocalDate asOfDate) {
        if (records == null) {
            throw new IllegalArgumentException("Medication records cannot be null");
        }
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date cannot be null");
        }

        NavigableSet<LocalDate> visits = new TreeSet<>();
        for (MedicationRecord record : records) {
            if (usable(record) && !record.getVisitDate().isAfter(asOfDate)) {
                visits.add(record.getVisitDate());
            }
        }
        if (visits.size() < 2) {
            return Optional.empty();
        }
        LocalDate later = visits.last();
        return Optional.of(compare(records, visits.lower(later), later));
    }

    /**
     * Compare what was prescribed at two visits
     * @param records Validated medication records
     * @param earlierVisit Visit to compare from
     * @param laterVisit Visit to compare to; must be after the earlier visit
     * @return New, restarted, discontinued and continued drugs plus regimen changes
     */
    public VisitComparison compare(Collection<MedicationRecord> records, LocalDate earlierVisit, LocalDate laterVisit) {
        if (records == null) {
            throw new IllegalArgumentException("Medication records cannot be null");
        }
        if (earlierVisit == null || laterVisit == null) {
            throw new IllegalArgumentException("Visit dates cannot be null");
        }
        if (!laterVisit.isAfter(earlierVisit)) {
            throw new IllegalArgumentException("Later visit " + laterVisit + " must be after " + earlierVisit);
        }

        Map<String, MedicationRecord> before = recordedAt(records, earlierVisit);
        Map<String, MedicationRecord> after = recordedAt(records, laterVisit);
        Set<String> seenEarlier = new TreeSet<>();
        for (MedicationRecord record : records) {
            if (usable(record) && record.getVisitDate().isBefore(earlierVisit)) {
                seenEarlier.add(record.getDrugIdentity());
            }
        }

        List<String> newDrugs = new ArrayList<>();
        List<String> restarted = new ArrayList<>();
        List<String> continued = new ArrayList<>();
        List<VisitComparison.RegimenChange> changes = new ArrayList<>();
        for (Map.Entry<String, MedicationRecord> entry : after.entrySet()) {
            String drug = entry.getKey();
            MedicationRecord current = entry.getValue();
            MedicationRecord previous = before.get(drug);
            if (previous == null) {
                if (seenEarlier.contains(drug)) {
                    restarted.add(drug);
                } else {
                    newDrugs.add(drug);
                }
                continue;
            }
            continued.add(drug);
            if (!previous.getDose().sameAmount(current.getDose())) {
                changes.add(new VisitComparison.RegimenChange(drug, VisitComparison.Aspect.DOSE,
                        previous.getDose().toString(), current.getDose().toString()));
            }
            if (previous.getFrequency() != current.getFrequency()) {
                changes.add(new VisitComparison.RegimenChange(drug, VisitComparison.Aspect.FREQUENCY,
                        previous.getFrequency().getCode(), current.getFrequency().getCode()));
            }
        }

        List<String> discontinued = new ArrayList<>();
        for (String drug : before.keySet()) {
            if (!after.containsKey(drug)) {
                discontinued.add(drug);
            }
        }

        logger.debug("Visit {} -> {}: {} new, {} restarted, {} discontinued, {} continued, {} regimen changes",
                earlierVisit, laterVisit, newDrugs.size(), restarted.size(), discontinued.size(),
                continued.size(), changes.size());
        return new VisitComparison(earlierVisit, laterVisit, newDrugs, restarted, discontinued, continued, changes);
    }

    /**
     * The record each drug was given at a visit; several records for one drug resolve to the
     * most recently recorded, as on the timeline
     */
    private Map<String, MedicationRecord> recordedAt(Collection<MedicationRecord> records, LocalDate visit) {
        Map<String, MedicationRecord> byDrug = new TreeMap<>();
        for (MedicationRecord record : records) {
            if (!usable(record) || !record.getVisitDate().equals(visit)) {
                continue;
            }
            byDrug.merge(record.getDrugIdentity(), record,
                    (kept, candidate) -> TimelineBuilder.RECENCY.compare(kept, candidate) >= 0 ? kept : candidate);
        }
        return byDrug;
    }

    private static boolean usable(MedicationRecord record) {
        return record != null && record.getDrugIdentity() != null && record.getVisitDate() != null;
    }
}
