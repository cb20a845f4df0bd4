package ru.tigran.assistantloganalytics.analytics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.assistantloganalytics.classifier.IntentClassifier;
import ru.tigran.assistantloganalytics.classifier.InternalUserRule;
import ru.tigran.assistantloganalytics.classifier.TermOccurrenceCounter;
import ru.tigran.assistantloganalytics.dto.AnalyticsReport;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;
import static ru.tigran.assistantloganalytics.analytics.LogRecords.record;

@DisplayName("AnalyticsReportService unit тесты")
class AnalyticsReportServiceTest {

    private TrafficAnalyzer trafficAnalyzer;
    private ContentAnalyzer contentAnalyzer;
    private AudienceAnalyzer audienceAnalyzer;
    private SummaryComposer summaryComposer;

    private final LogSnapshot snapshot = new LogSnapshot("snap-1", "logs.csv", Instant.now(), 3, List.of(
            record("你好", "2024-01-01 09:15:00", "u1"),
            record("铜价多少", "2024-01-01 10:00:00", "u2"),
            record("铝库存", "2024-01-02 11:00:00", "u1")
    ));

    @BeforeEach
    void setUp() {
        trafficAnalyzer = new TrafficAnalyzer();
        contentAnalyzer = new ContentAnalyzer(new IntentClassifier(), new TermOccurrenceCounter());
        audienceAnalyzer = new AudienceAnalyzer(new InternalUserRule());
        summaryComposer = new SummaryComposer(trafficAnalyzer, audienceAnalyzer, new RetentionEstimator());
    }

    @Test
    @DisplayName("buildReport - отчет совпадает с отдельными представлениями")
    void buildReportMatchesIndividualViews() {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            AnalyticsReportService service = new AnalyticsReportService(
                    trafficAnalyzer, contentAnalyzer, audienceAnalyzer, summaryComposer, executor);

            AnalyticsReport report = service.buildReport(snapshot);
            List<LogRecord> records = snapshot.records();

            assertEquals("snap-1", report.snapshotId());
            assertEquals(summaryComposer.summaryStats(records), report.summary());
            assertEquals(trafficAnalyzer.dailyTrend(records), report.dailyTrend());
            assertEquals(trafficAnalyzer.hourlyStats(records), report.hourlyStats());
            assertEquals(audienceAnalyzer.sourceDistribution(records), report.sources());
            assertEquals(contentAnalyzer.classifyIntents(records), report.intents());
            assertEquals(contentAnalyzer.metalDistribution(records), report.metals());
            assertEquals(contentAnalyzer.topKeywords(records), report.keywords());
            assertEquals(audienceAnalyzer.topCompanies(records), report.companies());
            assertEquals(audienceAnalyzer.userTypeDistribution(records), report.userTypes());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("buildReport - исключение представления пробрасывается без обертки")
    void buildReportPropagatesViewFailure() {
        TrafficAnalyzer failingAnalyzer = mock(TrafficAnalyzer.class);
        when(failingAnalyzer.hourlyStats(anyList())).thenThrow(new IllegalStateException("boom"));
        AnalyticsReportService service = new AnalyticsReportService(
                failingAnalyzer, contentAnalyzer, audienceAnalyzer, summaryComposer, Runnable::run);

        IllegalStateException exception = assertThrows(IllegalStateException.class,
                () -> service.buildReport(snapshot));
        assertEquals("boom", exception.getMessage());
    }
}
