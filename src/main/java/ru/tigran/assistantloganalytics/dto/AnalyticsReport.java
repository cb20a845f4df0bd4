package ru.tigran.assistantloganalytics.dto;

import java.util.List;

/**
 * All derived views of one snapshot, as consumed by the dashboard in a single request.
 */
public record AnalyticsReport(
        String snapshotId,
        AnalysisSummary summary,
        List<DailyTrend> dailyTrend,
        List<HourlyStats> hourlyStats,
        List<NamedValue> sources,
        List<NamedValue> intents,
        List<NamedValue> metals,
        List<KeywordFrequency> keywords,
        List<NamedValue> companies,
        List<NamedValue> userTypes
) {
}
