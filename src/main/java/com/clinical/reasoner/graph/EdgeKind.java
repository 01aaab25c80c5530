package com.clinical.reasoner.graph;

import java.util.Locale;

public enum EdgeKind {
    /** patient to medication, from medication records */
    TAKES,
    /** patient to chronic condition */
    HAS_CONDITION,
    /** patient to allergy */
    HAS_ALLERGY,
    /** medication to condition or symptom named on the same prescription */
    PRESCRIBED_FOR,
    /** medication to medication, from interaction findings */
    INTERACTS_WITH,
    /** medication to condition, from contraindication findings */
    CONTRAINDICATED_BY,
    /** medication to allergy, from allergy findings */
    ALLERGIC_TO;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
