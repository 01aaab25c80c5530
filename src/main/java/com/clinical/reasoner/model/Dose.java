package com.clinical.reasoner.model;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Dose amount per administration: a decimal value and a unit.
 * Mass units normalize to mg and volume units to ml for comparison.
 */
public final class Dose {

    private static final BigDecimal THOUSAND = new BigDecimal("1000");

    private final BigDecimal value;
    private final String unit;

    public Dose(BigDecimal value, String unit) {
        this.value = value != null ? value.stripTrailingZeros() : null;
        this.unit = unit != null ? unit.trim().toLowerCase(Locale.ROOT) : "";
    }

    public static Dose of(String value, String unit) {
        return new Dose(new BigDecimal(value), unit);
    }

    public static Dose unspecified() {
        return new Dose(null, "");
    }

    public BigDecimal getValue() {
        return value;
    }

    public String getUnit() {
        return unit;
    }

    public boolean isSpecified() {
        return value != null;
    }

    /**
     * Compare this dose with another when both can be expressed in the same base unit
     * @param other Dose to compare against
     * @return Negative, zero or positive as with compareTo; empty when the units are incomparable
     *         or either dose is unspecified
     */
    public Optional<Integer> compareAmount(Dose other) {
        if (other == null || !isSpecified() || !other.isSpecified()) {
            return Optional.empty();
        }
        Optional<BigDecimal> a = normalized();
        Optional<BigDecimal> b = other.normalized();
        if (a.isPresent() && b.isPresent() && baseUnit().equals(other.baseUnit())) {
            return Optional.of(a.get().compareTo(b.get()));
        }
        if (unit.equals(other.unit)) {
            return Optional.of(value.compareTo(other.value));
        }
        return Optional.empty();
    }

    /**
     * @return true when both doses describe the same amount (after unit normalization)
     */
    public boolean sameAmount(Dose other) {
        if (other == null) {
            return false;
        }
        if (!isSpecified() && !other.isSpecified()) {
            return true;
        }
        Optional<Integer> cmp = compareAmount(other);
        return cmp.isPresent() && cmp.get() == 0;
    }

    private String baseUnit() {
        return switch (unit) {
            case "mcg", "ug", "µg", "mg", "g" -> "mg";
            case "ml", "l" -> "ml";
            default -> unit;
        };
    }

    private Optional<BigDecimal> normalized() {
        if (value == null) {
            return Optional.empty();
        }
        return switch (unit) {
            case "mcg", "ug", "µg" -> Optional.of(value.divide(THOUSAND));
            case "mg", "ml" -> Optional.of(value);
            case "g", "l" -> Optional.of(value.multiply(THOUSAND));
            default -> Optional.empty();
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dose other)) {
            return false;
        }
        return Objects.equals(value, other.value) && unit.equals(other.unit);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        if (value == null) {
            return "unspecified dose";
        }
        return value.toPlainString() + (unit.isEmpty() ? "" : unit);
    }
}
