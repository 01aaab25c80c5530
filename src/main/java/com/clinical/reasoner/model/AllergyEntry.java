package com.clinical.reasoner.model;

import java.util.Locale;
import java.util.Objects;

/**
 * A patient allergy: the substance (or drug class) plus an optional reaction type.
 * Parsed from strings of the form {@code substance} or {@code substance:reaction}.
 */
public final class AllergyEntry implements Comparable<AllergyEntry> {

    private final String substance;
    private final String reactionType;

    public AllergyEntry(String substance, String reactionType) {
        if (substance == null || substance.isBlank()) {
            throw new IllegalArgumentException("Allergy substance cannot be blank");
        }
        this.substance = substance.trim().toLowerCase(Locale.ROOT);
        this.reactionType = reactionType == null || reactionType.isBlank()
                ? null
                : reactionType.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Parse an allergy string
     * @param raw "penicillin" or "penicillin:rash"
     * @return Parsed entry
     */
    public static AllergyEntry parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Allergy cannot be blank");
        }
        int idx = raw.indexOf(':');
        if (idx < 0) {
            return new AllergyEntry(raw, null);
        }
        return new AllergyEntry(raw.substring(0, idx), raw.substring(idx + 1));
    }

    public String getSubstance() {
        return substance;
    }

    public String getReactionType() {
        return reactionType;
    }

    @Override
    public int compareTo(AllergyEntry o) {
        int c = substance.compareTo(o.substance);
        if (c != 0) {
            return c;
        }
        return Objects.toString(reactionType, "").compareTo(Objects.toString(o.reactionType, ""));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AllergyEntry other)) {
            return false;
        }
        return substance.equals(other.substance) && Objects.equals(reactionType, other.reactionType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(substance, reactionType);
    }

    @Override
    public String toString() {
        return reactionType == null ? substance : substance + ":" + reactionType;
    }
}
