package com.clinical.reasoner.model;

import java.util.Locale;

/**
 * Classification of a transition between consecutive periods of one drug
 */
public enum ChangeKind {
    STARTED,
    STOPPED,
    DOSE_INCREASED,
    DOSE_DECREASED,
    FREQUENCY_CHANGED,
    CONTINUED,
    RESUMED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
