package com.clinical.reasoner.model;

/**
 * How an active drug matched a recorded allergy
 */
public enum AllergyMatch {
    /** The allergy names the drug itself. */
    SUBSTANCE,
    /** The allergy names a therapeutic class the drug belongs to. */
    DRUG_CLASS,
    /** A catalog cross-reactivity rule links the allergen to the drug or its class. */
    CROSS_REACTIVITY
}
