package ru.tigran.assistantloganalytics.dto;

/**
 * Traffic of one calendar date.
 *
 * @param date    date portion of the timestamp, {@code YYYY-MM-DD}
 * @param queries number of questions asked that day
 * @param dau     distinct non-empty user ids seen that day
 */
public record DailyTrend(
        String date,
        long queries,
        long dau
) {
}
