package ru.tigran.assistantloganalytics.analytics;

import java.util.OptionalInt;

/**
 * Lenient accessors for the {@code YYYY-MM-DD HH:MM:SS} timestamp text.
 * No calendar parsing: dates are compared as strings.
 */
final class TimestampParts {

    private TimestampParts() {
    }

    /**
     * @return text before the first space, or the whole timestamp when there is none
     */
    static String datePart(String timestamp) {
        int space = timestamp.indexOf(' ');
        return space < 0 ? timestamp : timestamp.substring(0, space);
    }

    /**
     * Reads the leading integer of the time portion (text after the first space, up to the first colon).
     *
     * @return hour in [0, 23], or empty when it is missing or out of range
     */
    static OptionalInt hourOf(String timestamp) {
        int space = timestamp.indexOf(' ');
        if (space < 0) {
            return OptionalInt.empty();
        }
        int end = timestamp.indexOf(' ', space + 1);
        String time = end < 0 ? timestamp.substring(space + 1) : timestamp.substring(space + 1, end);

        int hour = 0;
        int digits = 0;
        while (digits < time.length() && isAsciiDigit(time.charAt(digits))) {
            hour = hour * 10 + (time.charAt(digits) - '0');
            if (hour > 23) {
                return OptionalInt.empty();
            }
            digits++;
        }
        return digits == 0 ? OptionalInt.empty() : OptionalInt.of(hour);
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
