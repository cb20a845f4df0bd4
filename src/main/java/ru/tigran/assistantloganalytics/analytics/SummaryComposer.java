package ru.tigran.assistantloganalytics.analytics;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.dto.AnalysisSummary;
import ru.tigran.assistantloganalytics.dto.DailyTrend;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.List;
import java.util.function.Function;
import java.util.function.ToLongFunction;

/**
 * Builds the top-line {@link AnalysisSummary} from the other views.
 */
@Component
public class SummaryComposer {

    static final String NOT_AVAILABLE = "N/A";

    private final TrafficAnalyzer trafficAnalyzer;
    private final AudienceAnalyzer audienceAnalyzer;
    private final RetentionEstimator retentionEstimator;

    public SummaryComposer(
            TrafficAnalyzer trafficAnalyzer,
            AudienceAnalyzer audienceAnalyzer,
            RetentionEstimator retentionEstimator
    ) {
        this.trafficAnalyzer = trafficAnalyzer;
        this.audienceAnalyzer = audienceAnalyzer;
        this.retentionEstimator = retentionEstimator;
    }

    /**
     * Ties for top source and busiest day go to the first entry among the maxima:
     * first-seen source, earliest date.
     */
    public AnalysisSummary summaryStats(List<LogRecord> records) {
        long totalQueries = records.size();
        // empty userId is deliberately counted as one user
        long uniqueUsers = records.stream().map(LogRecord::userId).distinct().count();
        double avgQueriesPerUser = uniqueUsers > 0 ? (double) totalQueries / uniqueUsers : 0;

        String topSource = firstMaximum(audienceAnalyzer.sourceDistribution(records),
                NamedValue::value, NamedValue::name);
        String busiestDay = firstMaximum(trafficAnalyzer.dailyTrend(records),
                DailyTrend::queries, DailyTrend::date);

        return new AnalysisSummary(
                totalQueries,
                uniqueUsers,
                avgQueriesPerUser,
                retentionEstimator.nextDayRetention(records),
                topSource,
                busiestDay
        );
    }

    private static <T> String firstMaximum(List<T> items, ToLongFunction<T> value, Function<T, String> label) {
        T best = null;
        for (T item : items) {
            if (best == null || value.applyAsLong(item) > value.applyAsLong(best)) {
                best = item;
            }
        }
        return best == null ? NOT_AVAILABLE : label.apply(best);
    }
}
