package ru.tigran.assistantloganalytics.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.assistantloganalytics.analytics.AnalyticsReportService;
import ru.tigran.assistantloganalytics.dto.AnalysisSummary;
import ru.tigran.assistantloganalytics.dto.AnalyticsReport;
import ru.tigran.assistantloganalytics.dto.DailyTrend;
import ru.tigran.assistantloganalytics.dto.HourlyStats;
import ru.tigran.assistantloganalytics.dto.KeywordFrequency;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;

import java.util.List;

/**
 * Read-only views over the active snapshot.
 * Every endpoint answers 404 until a log file has been ingested.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analytics")
@Tag(name = "Analytics", description = "Аналитика по активному набору логов")
@ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Успешный ответ"),
        @ApiResponse(responseCode = "404", description = "Данные еще не загружались")
})
public class AnalyticsController {

    private final AnalyticsReportService analyticsReportService;
    private final LogSnapshotStore snapshotStore;

    public AnalyticsController(AnalyticsReportService analyticsReportService, LogSnapshotStore snapshotStore) {
        this.analyticsReportService = analyticsReportService;
        this.snapshotStore = snapshotStore;
    }

    @GetMapping("/report")
    @Operation(summary = "Полный отчет", description = "Все представления одним ответом, кешируется до следующей загрузки")
    public ResponseEntity<AnalyticsReport> getReport() {
        log.info("GET /api/v1/analytics/report");
        return ResponseEntity.ok(currentReport());
    }

    @GetMapping("/summary")
    @Operation(summary = "Ключевые метрики", description = "Всего запросов, уникальные пользователи, retention, топ источник, самый загруженный день")
    public ResponseEntity<AnalysisSummary> getSummary() {
        return ResponseEntity.ok(currentReport().summary());
    }

    @GetMapping("/daily-trend")
    @Operation(summary = "Запросы и DAU по дням")
    public ResponseEntity<List<DailyTrend>> getDailyTrend() {
        return ResponseEntity.ok(currentReport().dailyTrend());
    }

    @GetMapping("/hourly")
    @Operation(summary = "Распределение запросов по часам суток")
    public ResponseEntity<List<HourlyStats>> getHourlyStats() {
        return ResponseEntity.ok(currentReport().hourlyStats());
    }

    @GetMapping("/sources")
    @Operation(summary = "Распределение по источникам")
    public ResponseEntity<List<NamedValue>> getSources() {
        return ResponseEntity.ok(currentReport().sources());
    }

    @GetMapping("/intents")
    @Operation(summary = "Классификация интентов")
    public ResponseEntity<List<NamedValue>> getIntents() {
        return ResponseEntity.ok(currentReport().intents());
    }

    @GetMapping("/metals")
    @Operation(summary = "Упоминания металлов и сырья")
    public ResponseEntity<List<NamedValue>> getMetals() {
        return ResponseEntity.ok(currentReport().metals());
    }

    @GetMapping("/keywords")
    @Operation(summary = "Частота бизнес ключевых слов")
    public ResponseEntity<List<KeywordFrequency>> getKeywords() {
        return ResponseEntity.ok(currentReport().keywords());
    }

    @GetMapping("/companies")
    @Operation(summary = "Топ 10 компаний", description = "Внутренние пользователи объединены в одну группу")
    public ResponseEntity<List<NamedValue>> getCompanies() {
        return ResponseEntity.ok(currentReport().companies());
    }

    @GetMapping("/user-types")
    @Operation(summary = "Внутренние, внешние и неизвестные пользователи")
    public ResponseEntity<List<NamedValue>> getUserTypes() {
        return ResponseEntity.ok(currentReport().userTypes());
    }

    private AnalyticsReport currentReport() {
        return analyticsReportService.buildReport(snapshotStore.require());
    }
}
