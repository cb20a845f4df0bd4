package ru.tigran.assistantloganalytics.dto;

/**
 * AI-generated narrative analysis of a snapshot.
 *
 * @param snapshotId id of the analysed snapshot
 * @param sampleSize number of records sent to the AI provider
 * @param html       HTML fragment, or failure markup when the call did not succeed
 * @param successful false when {@code html} holds failure markup
 */
public record InsightResponse(
        String snapshotId,
        int sampleSize,
        String html,
        boolean successful
) {
}
