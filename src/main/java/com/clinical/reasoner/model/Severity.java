package com.clinical.reasoner.model;

import java.util.Locale;

/**
 * Severity taxonomy for safety findings, ordered minor &lt; moderate &lt; major &lt; contraindicated.
 */
public enum Severity {
    MINOR,
    MODERATE,
    MAJOR,
    CONTRAINDICATED;

    /**
     * Parse a catalog severity value
     * @param value Severity text, case-insensitive
     * @return Matching severity
     * @throws IllegalArgumentException if the value is not a known severity
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity cannot be blank");
        }
        return Severity.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public boolean isAtLeast(Severity other) {
        return this.compareTo(other) >= 0;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
