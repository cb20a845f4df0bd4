package ru.tigran.assistantloganalytics.dto;

/**
 * Question count for one hour of the day, labelled {@code "H:00"}.
 */
public record HourlyStats(
        String hour,
        long count
) {
}
