package ru.tigran.assistantloganalytics.dto;

/**
 * Top-line metrics of a snapshot.
 *
 * Example:
 * {
 *   "totalQueries": 1250,
 *   "uniqueUsers": 310,
 *   "avgQueriesPerUser": 4.03,
 *   "retentionRate": 37.5,
 *   "topSource": "App",
 *   "busiestDay": "2024-03-12"
 * }
 */
public record AnalysisSummary(
        long totalQueries,
        long uniqueUsers,        // Distinct userId values, the empty id counts as one
        double avgQueriesPerUser,
        double retentionRate,    // Mean next-day retention, percent
        String topSource,        // "N/A" when there is no data
        String busiestDay        // "N/A" when there is no data
) {
}
