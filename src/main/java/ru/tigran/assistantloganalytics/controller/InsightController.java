package ru.tigran.assistantloganalytics.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import ru.tigran.assistantloganalytics.dto.InsightResponse;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;
import ru.tigran.assistantloganalytics.service.LogInsightService;

@Slf4j
@RestController
@RequestMapping("/api/v1/insights")
@Tag(name = "AI Insights", description = "AI анализ поведения пользователей по выборке вопросов")
public class InsightController {

    private final LogInsightService logInsightService;
    private final LogSnapshotStore snapshotStore;

    public InsightController(LogInsightService logInsightService, LogSnapshotStore snapshotStore) {
        this.logInsightService = logInsightService;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Asks the AI provider for an HTML analysis of the active snapshot.
     * Handled asynchronously; a disconnecting client cancels the provider call.
     * Provider failures are reported in the body with {@code successful=false}, not as an error status.
     */
    @GetMapping
    @Operation(
            summary = "Получить AI анализ",
            description = "Отправляет до 150 содержательных вопросов AI провайдеру и возвращает HTML фрагмент. " +
                    "При ошибке провайдера возвращается HTML с сообщением об ошибке и successful=false."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "HTML анализ или сообщение об ошибке",
                    content = @Content(schema = @Schema(implementation = InsightResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Данные еще не загружались")
    })
    public Mono<InsightResponse> getInsight() {
        log.info("GET /api/v1/insights");
        return logInsightService.generateInsight(snapshotStore.require());
    }
}
