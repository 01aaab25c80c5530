package com.clinical.reasoner.model;

import java.util.List;

/**
 * Two or more active drugs in one therapeutic class, or one drug active under two
 * overlapping regimens
 */
public final class DuplicateTherapyFinding extends Finding {

    private final List<String> drugs;
    private final String therapeuticClass;

    /**
     * @param therapeuticClass shared class, or null when the duplicate is the same drug twice
     */
    public DuplicateTherapyFinding(List<String> drugs, String therapeuticClass, Severity severity,
                                   String ruleId, String mechanism, String recommendation,
                                   List<String> sourceRecordIds, double factConfidence, double ruleConfidence) {
        super(FindingKind.DUPLICATE_THERAPY, severity, drugs, ruleId, List.of(), mechanism, recommendation,
                sourceRecordIds, factConfidence, ruleConfidence);
        this.drugs = List.copyOf(drugs);
        this.therapeuticClass = therapeuticClass;
    }

    public List<String> getDrugs() {
        return drugs;
    }

    public String getTherapeuticClass() {
        return therapeuticClass;
    }

    public boolean isSameDrug() {
        return therapeuticClass == null;
    }

    @Override
    public String summary() {
        if (isSameDrug()) {
            return drugs.get(0) + " active under overlapping regimens";
        }
        return String.join(", ", drugs) + " share class " + therapeuticClass;
    }
}
