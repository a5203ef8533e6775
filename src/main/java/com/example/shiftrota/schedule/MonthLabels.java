package com.example.shiftrota.schedule;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * "March 2025" style month keys of a schedule document.
 */
public final class MonthLabels {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);

    private MonthLabels() {
    }

    public static String format(YearMonth month) {
        return FORMAT.format(month);
    }

    public static Optional<YearMonth> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(YearMonth.parse(label.trim(), FORMAT));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
