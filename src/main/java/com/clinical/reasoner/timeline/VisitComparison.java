package com.clinical.reasoner.timeline;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * Differences between the prescriptions recorded at two visits
 */
public final class VisitComparison {

    /**
     * Part of a regimen that differs between the two visits
     */
    public enum Aspect {
        DOSE,
        FREQUENCY
    }

    /**
     * One drug whose dose or frequency differs between the visits
     */
    public static final class RegimenChange {
        private final String drugIdentity;
        private final Aspect aspect;
        private final String from;
        private final String to;

        public RegimenChange(String drugIdentity, Aspect aspect, String from, String to) {
            this.drugIdentity = drugIdentity;
            this.aspect = aspect;
            this.from = from;
            this.to = to;
        }

        public String getDrugIdentity() {
            return drugIdentity;
        }

        public Aspect getAspect() {
            return aspect;
        }

        public String getFrom() {
            return from;
        }

        public String getTo() {
            return to;
        }

        @Override
        public String toString() {
            return drugIdentity + " " + aspect.name().toLowerCase(Locale.ROOT) + " " + from + " -> " + to;
        }
    }

    private final LocalDate earlierVisit;
    private final LocalDate laterVisit;
    private final List<String> newDrugs;
    private final List<String> restartedDrugs;
    private final List<String> discontinuedDrugs;
    private final List<String> continuedDrugs;
    private final List<RegimenChange> regimenChanges;

    public VisitComparison(LocalDate earlierVisit, LocalDate laterVisit, List<String> newDrugs,
                           List<String> restartedDrugs, List<String> discontinuedDrugs,
                           List<String> continuedDrugs, List<RegimenChange> regimenChanges) {
        this.earlierVisit = earlierVisit;
        this.laterVisit = laterVisit;
        this.newDrugs = List.copyOf(newDrugs);
        this.restartedDrugs = List.copyOf(restartedDrugs);
        this.discontinuedDrugs = List.copyOf(discontinuedDrugs);
        this.continuedDrugs = List.copyOf(continuedDrugs);
        this.regimenChanges = List.copyOf(regimenChanges);
    }

    public LocalDate getEarlierVisit() {
        return earlierVisit;
    }

    public LocalDate getLaterVisit() {
        return laterVisit;
    }

    /**
     * @return Drugs at the later visit never recorded at any earlier visit
     */
    public List<String> getNewDrugs() {
        return newDrugs;
    }

    /**
     * @return Drugs at the later visit that were absent from the earlier visit but recorded before it
     */
    public List<String> getRestartedDrugs() {
        return restartedDrugs;
    }

    public List<String> getDiscontinuedDrugs() {
        return discontinuedDrugs;
    }

    /**
     * @return Drugs recorded at both visits, whether or not their regimen changed
     */
    public List<String> getContinuedDrugs() {
        return continuedDrugs;
    }

    public List<RegimenChange> getRegimenChanges() {
        return regimenChanges;
    }

    public boolean hasDifferences() {
        return !newDrugs.isEmpty() || !restartedDrugs.isEmpty() || !discontinuedDrugs.isEmpty()
                || !regimenChanges.isEmpty();
    }
}
