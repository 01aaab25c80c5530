package com.clinical.reasoner.model;

import java.util.Locale;

/**
 * Route of administration
 */
public enum Route {
    ORAL,
    INTRAVENOUS,
    INTRAMUSCULAR,
    SUBCUTANEOUS,
    TOPICAL,
    INHALED,
    SUBLINGUAL,
    RECTAL,
    TRANSDERMAL,
    OPHTHALMIC,
    OTIC,
    NASAL,
    OTHER;

    /**
     * Map a route code or display text to a route. Unrecognized values map to OTHER.
     * @param value Route text such as "PO", "oral", "IV"
     * @return Route, never null
     */
    public static Route fromCode(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "po", "oral", "by mouth", "orally" -> ORAL;
            case "iv", "intravenous", "intravenously" -> INTRAVENOUS;
            case "im", "intramuscular" -> INTRAMUSCULAR;
            case "sc", "sq", "subcut", "subcutaneous" -> SUBCUTANEOUS;
            case "topical", "top", "cutaneous" -> TOPICAL;
            case "inh", "inhaled", "inhalation", "respiratory tract" -> INHALED;
            case "sl", "sublingual" -> SUBLINGUAL;
            case "pr", "rectal" -> RECTAL;
            case "td", "transdermal" -> TRANSDERMAL;
            case "ophthalmic", "eye" -> OPHTHALMIC;
            case "otic", "ear" -> OTIC;
            case "nasal", "intranasal" -> NASAL;
            default -> OTHER;
        };
    }
}
