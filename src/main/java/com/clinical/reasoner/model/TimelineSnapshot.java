package com.clinical.reasoner.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * All medication periods of one patient plus the subset active on the as-of date
 */
public final class TimelineSnapshot {

    private final LocalDate asOfDate;
    private final SortedMap<String, List<MedicationPeriod>> periodsByDrug;
    private final List<TreatmentGap> treatmentGaps;
    private final List<PeriodOverlap> overlaps;
    private final List<ConcurrentUse> concurrentUse;

    public TimelineSnapshot(LocalDate asOfDate, Map<String, List<MedicationPeriod>> periodsByDrug,
                            List<TreatmentGap> treatmentGaps, List<PeriodOverlap> overlaps,
                            List<ConcurrentUse> concurrentUse) {
        this.asOfDate = asOfDate;
        TreeMap<String, List<MedicationPeriod>> copy = new TreeMap<>();
        periodsByDrug.forEach((drug, periods) -> copy.put(drug, List.copyOf(periods)));
        this.periodsByDrug = Collections.unmodifiableSortedMap(copy);
        this.treatmentGaps = treatmentGaps != null ? List.copyOf(treatmentGaps) : List.of();
        this.overlaps = overlaps != null ? List.copyOf(overlaps) : List.of();
        this.concurrentUse = concurrentUse != null ? List.copyOf(concurrentUse) : List.of();
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }

    public SortedMap<String, List<MedicationPeriod>> getPeriodsByDrug() {
        return periodsByDrug;
    }

    public List<MedicationPeriod> getPeriods(String drugIdentity) {
        return periodsByDrug.getOrDefault(drugIdentity, List.of());
    }

    /**
     * @return Every period, grouped by drug and ordered by start date within a drug
     */
    public List<MedicationPeriod> getAllPeriods() {
        List<MedicationPeriod> all = new ArrayList<>();
        periodsByDrug.values().forEach(all::addAll);
        return all;
    }

    /**
     * @return Periods active on the as-of date
     */
    public List<MedicationPeriod> getActivePeriods() {
        List<MedicationPeriod> active = new ArrayList<>();
        for (List<MedicationPeriod> periods : periodsByDrug.values()) {
            for (MedicationPeriod period : periods) {
                if (period.isActiveOn(asOfDate)) {
                    active.add(period);
                }
            }
        }
        return active;
    }

    /**
     * @return Drug identities with at least one period active on the as-of date
     */
    public SortedSet<String> getActiveDrugs() {
        TreeSet<String> drugs = new TreeSet<>();
        for (MedicationPeriod period : getActivePeriods()) {
            drugs.add(period.getDrugIdentity());
        }
        return drugs;
    }

    public List<TreatmentGap> getTreatmentGaps() {
        return treatmentGaps;
    }

    public List<PeriodOverlap> getOverlaps() {
        return overlaps;
    }

    public List<ConcurrentUse> getConcurrentUse() {
        return concurrentUse;
    }
}
