package com.clinical.reasoner.model;

import java.util.Locale;

/**
 * Closed set of safety finding kinds
 */
public enum FindingKind {
    DRUG_DRUG_INTERACTION,
    DRUG_CLASS_INTERACTION,
    ALLERGY_CONFLICT,
    CONTRAINDICATION,
    DUPLICATE_THERAPY;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
