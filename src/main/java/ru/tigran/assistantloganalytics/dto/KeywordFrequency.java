package ru.tigran.assistantloganalytics.dto;

public record KeywordFrequency(
        String keyword,
        long count
) {
}
