package com.clinical.reasoner.evidence;

import java.util.Locale;

/**
 * Coarse label for a numeric confidence, used in rendered rationales
 */
public enum ConfidenceBand {
    HIGH(0.9),
    MODERATE(0.7),
    LOW(0.5),
    VERY_LOW(0.0);

    private final double lowerBound;

    ConfidenceBand(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public static ConfidenceBand of(double confidence) {
        for (ConfidenceBand band : values()) {
            if (confidence >= band.lowerBound) {
                return band;
            }
        }
        return VERY_LOW;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }
}
