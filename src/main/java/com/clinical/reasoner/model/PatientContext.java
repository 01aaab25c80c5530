package com.clinical.reasoner.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Patient facts supplied by the caller: allergies, chronic conditions and the as-of date
 * every evaluation is anchored to. Read-only to the engine.
 */
public final class PatientContext {

    private final SortedSet<AllergyEntry> allergies;
    private final SortedSet<String> chronicConditions;
    private final LocalDate asOfDate;

    public PatientContext(Collection<String> allergies, Collection<String> chronicConditions, LocalDate asOfDate) {
        if (asOfDate == null) {
            throw new IllegalArgumentException("As-of date cannot be null");
        }
        TreeSet<AllergyEntry> parsedAllergies = new TreeSet<>();
        if (allergies != null) {
            for (String allergy : allergies) {
                if (allergy != null && !allergy.isBlank()) {
                    parsedAllergies.add(AllergyEntry.parse(allergy));
                }
            }
        }
        TreeSet<String> conditions = new TreeSet<>();
        if (chronicConditions != null) {
            for (String condition : chronicConditions) {
                if (condition != null && !condition.isBlank()) {
                    conditions.add(normalizeCondition(condition));
                }
            }
        }
        this.allergies = Collections.unmodifiableSortedSet(parsedAllergies);
        this.chronicConditions = Collections.unmodifiableSortedSet(conditions);
        this.asOfDate = asOfDate;
    }

    public static PatientContext empty(LocalDate asOfDate) {
        return new PatientContext(Set.of(), Set.of(), asOfDate);
    }

    /**
     * Canonical condition identifier: lower-cased, whitespace and hyphens collapsed to underscores
     * @param condition Condition name such as "Renal Impairment"
     * @return Identifier such as "renal_impairment"
     */
    public static String normalizeCondition(String condition) {
        return condition.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
    }

    public SortedSet<AllergyEntry> getAllergies() {
        return allergies;
    }

    public SortedSet<String> getChronicConditions() {
        return chronicConditions;
    }

    public LocalDate getAsOfDate() {
        return asOfDate;
    }
}
