package com.clinical.reasoner.evidence;

import java.util.Comparator;
import java.util.Objects;

/**
 * One fact consulted while producing a finding or change: a source record, a derived period,
 * a catalog rule or a patient fact
 */
public final class EvidenceFact {

    public enum Kind {
        RECORD,
        CONFLICTING_RECORD,
        PERIOD,
        TREATMENT_GAP,
        RULE,
        SUPPORTING_RULE,
        ALLERGY,
        CONDITION
    }

    static final Comparator<EvidenceFact> ORDER = Comparator
            .comparing(EvidenceFact::getKind)
            .thenComparing(EvidenceFact::getReference)
            .thenComparing(EvidenceFact::getDetail);

    private final Kind kind;
    private final String reference;
    private final String detail;

    public EvidenceFact(Kind kind, String reference, String detail) {
        this.kind = kind;
        this.reference = reference != null ? reference : "";
        this.detail = detail != null ? detail : "";
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return Record id, rule id, drug identity, allergen or condition identifier
     */
    public String getReference() {
        return reference;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvidenceFact other)) {
            return false;
        }
        return kind == other.kind && reference.equals(other.reference) && detail.equals(other.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, reference, detail);
    }

    @Override
    public String toString() {
        return kind + " " + reference + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
