package com.clinical.reasoner.model;

import java.util.Locale;

/**
 * Canonical dosing frequency. Each value carries its expected administrations per day;
 * as-needed and single doses carry zero.
 */
public enum Frequency {
    ONCE_DAILY("OD", 1.0),
    TWICE_DAILY("BD", 2.0),
    THREE_TIMES_DAILY("TDS", 3.0),
    FOUR_TIMES_DAILY("QID", 4.0),
    EVERY_FOUR_HOURS("Q4H", 6.0),
    EVERY_SIX_HOURS("Q6H", 4.0),
    EVERY_EIGHT_HOURS("Q8H", 3.0),
    AT_BEDTIME("HS", 1.0),
    ALTERNATE_DAYS("QOD", 0.5),
    WEEKLY("WEEKLY", 1.0 / 7.0),
    MONTHLY("MONTHLY", 1.0 / 30.0),
    AS_NEEDED("PRN", 0.0),
    ONCE("STAT", 0.0),
    UNSPECIFIED("UNSPECIFIED", 0.0);

    private final String code;
    private final double dosesPerDay;

    Frequency(String code, double dosesPerDay) {
        this.code = code;
        this.dosesPerDay = dosesPerDay;
    }

    public String getCode() {
        return code;
    }

    public double getDosesPerDay() {
        return dosesPerDay;
    }

    /**
     * Parse a prescription frequency abbreviation or phrase
     * @param value Frequency text such as "BD", "bid", "twice daily", "1-0-1"
     * @return Matching frequency, UNSPECIFIED when blank or unrecognized
     */
    public static Frequency fromCode(String value) {
        if (value == null || value.isBlank()) {
            return UNSPECIFIED;
        }
        String v = value.trim().toLowerCase(Locale.ROOT).replace(".", "");
        return switch (v) {
            case "od", "qd", "once daily", "daily", "once a day", "1-0-0", "0-0-1", "0-1-0" -> ONCE_DAILY;
            case "bd", "bid", "twice daily", "twice a day", "1-0-1" -> TWICE_DAILY;
            case "tds", "tid", "three times daily", "thrice daily", "1-1-1" -> THREE_TIMES_DAILY;
            case "qid", "qds", "four times daily", "1-1-1-1" -> FOUR_TIMES_DAILY;
            case "q4h", "every 4 hours" -> EVERY_FOUR_HOURS;
            case "q6h", "every 6 hours" -> EVERY_SIX_HOURS;
            case "q8h", "every 8 hours" -> EVERY_EIGHT_HOURS;
            case "hs", "qhs", "at bedtime", "at night" -> AT_BEDTIME;
            case "qod", "eod", "alternate days", "every other day" -> ALTERNATE_DAYS;
            case "weekly", "qw", "once weekly", "once a week" -> WEEKLY;
            case "monthly", "once monthly" -> MONTHLY;
            case "prn", "sos", "as needed", "when required" -> AS_NEEDED;
            case "stat", "once" -> ONCE;
            default -> UNSPECIFIED;
        };
    }

    /**
     * Map a structured timing (administrations per period) to a frequency
     * @param count Administrations per period
     * @param periodDays Length of the period in days
     * @return Closest canonical frequency, UNSPECIFIED when it cannot be mapped
     */
    public static Frequency fromTiming(int count, double periodDays) {
        if (count <= 0 || periodDays <= 0) {
            return UNSPECIFIED;
        }
        double perDay = count / periodDays;
        for (Frequency f : values()) {
            if (f != AT_BEDTIME && f != AS_NEEDED && f != ONCE && f != UNSPECIFIED
                    && Math.abs(f.dosesPerDay - perDay) < 1e-6) {
                return f;
            }
        }
        return UNSPECIFIED;
    }
}
