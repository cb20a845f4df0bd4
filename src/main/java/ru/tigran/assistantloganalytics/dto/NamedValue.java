package ru.tigran.assistantloganalytics.dto;

/**
 * Generic label to count pair used by the source, intent, metal,
 * company and user-type distributions.
 */
public record NamedValue(
        String name,
        long value
) {
}
