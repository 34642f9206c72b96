package com.content.reconciliation.matching;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts secondary descriptors (elapsed-time strings, calendar dates) into
 * comparable forms. Unparseable input yields {@code null} or {@code false},
 * never an exception.
 */
public final class DescriptorComparators {

    public static final int DEFAULT_DURATION_TOLERANCE_SECONDS = 2;
    public static final int DEFAULT_DATE_TOLERANCE_DAYS = 2;

    private static final Pattern SECONDS = Pattern.compile("^(\\d{1,9})$");
    private static final Pattern MINUTES_SECONDS = Pattern.compile("^(\\d{1,7}):(\\d{1,2})$");
    private static final Pattern HOURS_MINUTES_SECONDS = Pattern.compile("^(\\d{1,5}):(\\d{1,2}):(\\d{1,2})$");
    private static final Pattern ISO_DATE_TIME_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})[T ].*$");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US)
    );

    private DescriptorComparators() {
        // Utility class
    }

    /**
     * Parses {@code H:M:S}, {@code M:S} or a bare number of seconds.
     *
     * @return total seconds, or null when the text is missing or unparseable
     */
    public static Long toSeconds(String text) {
        if (text == null) {
            return null;
        }
        String value = text.trim();
        if (value.isEmpty()) {
            return null;
        }

        Matcher m = SECONDS.matcher(value);
        if (m.matches()) {
            return Long.parseLong(m.group(1));
        }
        m = MINUTES_SECONDS.matcher(value);
        if (m.matches()) {
            return Long.parseLong(m.group(1)) * 60 + Long.parseLong(m.group(2));
        }
        m = HOURS_MINUTES_SECONDS.matcher(value);
        if (m.matches()) {
            return Long.parseLong(m.group(1)) * 3600
                    + Long.parseLong(m.group(2)) * 60
                    + Long.parseLong(m.group(3));
        }
        return null;
    }

    public static boolean durationsEqual(String a, String b) {
        return durationsEqual(a, b, DEFAULT_DURATION_TOLERANCE_SECONDS);
    }

    /**
     * True when both durations parse and differ by at most {@code toleranceSeconds}.
     */
    public static boolean durationsEqual(String a, String b, int toleranceSeconds) {
        Long first = toSeconds(a);
        Long second = toSeconds(b);
        if (first == null || second == null) {
            return false;
        }
        return Math.abs(first - second) <= toleranceSeconds;
    }

    /**
     * Parses an ISO date, the date part of an ISO date-time, {@code M/d/yyyy}
     * or {@code MMM d, yyyy}.
     *
     * @return the date, or null when the text is missing or unparseable
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String value = text.trim();
        Matcher prefix = ISO_DATE_TIME_PREFIX.matcher(value);
        if (prefix.matches()) {
            value = prefix.group(1);
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                // try the next format
            }
        }
        return null;
    }

    public static boolean datesClose(String a, String b) {
        return datesClose(a, b, DEFAULT_DATE_TOLERANCE_DAYS);
    }

    /**
     * True when both dates parse and are at most {@code toleranceDays} apart.
     */
    public static boolean datesClose(String a, String b, int toleranceDays) {
        LocalDate first = parseDate(a);
        LocalDate second = parseDate(b);
        if (first == null || second == null) {
            return false;
        }
        return Math.abs(ChronoUnit.DAYS.between(first, second)) <= toleranceDays;
    }

    /**
     * Returns whichever date is earlier. Unparseable values lose to parseable ones;
     * when neither parses the current value is kept.
     */
    public static String earlierDate(String current, String candidate) {
        LocalDate currentDate = parseDate(current);
        LocalDate candidateDate = parseDate(candidate);
        if (candidateDate == null) {
            return current != null ? current : candidate;
        }
        if (currentDate == null || candidateDate.isBefore(currentDate)) {
            return candidate;
        }
        return current;
    }
}
