package ru.tigran.assistantloganalytics.analytics;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import ru.tigran.assistantloganalytics.dto.AnalysisSummary;
import ru.tigran.assistantloganalytics.dto.AnalyticsReport;
import ru.tigran.assistantloganalytics.dto.DailyTrend;
import ru.tigran.assistantloganalytics.dto.HourlyStats;
import ru.tigran.assistantloganalytics.dto.KeywordFrequency;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Computes every derived view of a snapshot.
 *
 * Views only read the immutable record list, so they are computed in parallel on
 * the analytics executor. Reports are cached per snapshot id; the cache is
 * cleared whenever a new snapshot becomes active.
 */
@Slf4j
@Service
public class AnalyticsReportService {

    public static final String REPORT_CACHE = "analyticsReports";

    private final TrafficAnalyzer trafficAnalyzer;
    private final ContentAnalyzer contentAnalyzer;
    private final AudienceAnalyzer audienceAnalyzer;
    private final SummaryComposer summaryComposer;
    private final Executor analyticsExecutor;

    public AnalyticsReportService(
            TrafficAnalyzer trafficAnalyzer,
            ContentAnalyzer contentAnalyzer,
            AudienceAnalyzer audienceAnalyzer,
            SummaryComposer summaryComposer,
            @Qualifier("analyticsExecutor") Executor analyticsExecutor
    ) {
        this.trafficAnalyzer = trafficAnalyzer;
        this.contentAnalyzer = contentAnalyzer;
        this.audienceAnalyzer = audienceAnalyzer;
        this.summaryComposer = summaryComposer;
        this.analyticsExecutor = analyticsExecutor;
    }

    @Cacheable(value = REPORT_CACHE, key = "#snapshot.id()")
    public AnalyticsReport buildReport(LogSnapshot snapshot) {
        List<LogRecord> records = snapshot.records();
        log.info("Building analytics report for snapshot {} ({} records)", snapshot.id(), records.size());

        CompletableFuture<AnalysisSummary> summary = compute(summaryComposer::summaryStats, records);
        CompletableFuture<List<DailyTrend>> dailyTrend = compute(trafficAnalyzer::dailyTrend, records);
        CompletableFuture<List<HourlyStats>> hourlyStats = compute(trafficAnalyzer::hourlyStats, records);
        CompletableFuture<List<NamedValue>> sources = compute(audienceAnalyzer::sourceDistribution, records);
        CompletableFuture<List<NamedValue>> intents = compute(contentAnalyzer::classifyIntents, records);
        CompletableFuture<List<NamedValue>> metals = compute(contentAnalyzer::metalDistribution, records);
        CompletableFuture<List<KeywordFrequency>> keywords = compute(contentAnalyzer::topKeywords, records);
        CompletableFuture<List<NamedValue>> companies = compute(audienceAnalyzer::topCompanies, records);
        CompletableFuture<List<NamedValue>> userTypes = compute(audienceAnalyzer::userTypeDistribution, records);

        return new AnalyticsReport(
                snapshot.id(),
                await(summary),
                await(dailyTrend),
                await(hourlyStats),
                await(sources),
                await(intents),
                await(metals),
                await(keywords),
                await(companies),
                await(userTypes)
        );
    }

    /**
     * Drops all cached reports. Called after a new snapshot becomes active.
     */
    @CacheEvict(value = REPORT_CACHE, allEntries = true)
    public void evictReports() {
        log.debug("Evicted cached analytics reports");
    }

    private <T> CompletableFuture<T> compute(Function<List<LogRecord>, T> view, List<LogRecord> records) {
        return CompletableFuture.supplyAsync(() -> view.apply(records), analyticsExecutor);
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
