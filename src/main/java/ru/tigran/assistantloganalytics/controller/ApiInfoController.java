package ru.tigran.assistantloganalytics.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Assistant Log Analytics API",
                "Сервис загрузки логов AI ассистента и расчета аналитики",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Загрузка логов",
                            "Загрузка CSV выгрузки и текущий набор данных",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/logs", "Загрузить CSV файл логов"),
                                    new ApiEndpoint("GET", "/api/v1/logs/current", "Метаданные текущего набора данных")
                            )
                    ),
                    new EndpointGroup(
                            "Аналитика",
                            "Представления по активному набору данных",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/analytics/report", "Полный отчет"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/summary", "Ключевые метрики"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/daily-trend", "Запросы и DAU по дням"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/hourly", "Запросы по часам"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/sources", "Источники"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/intents", "Интенты"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/metals", "Металлы"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/keywords", "Ключевые слова"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/companies", "Топ компаний"),
                                    new ApiEndpoint("GET", "/api/v1/analytics/user-types", "Типы пользователей")
                            )
                    ),
                    new EndpointGroup(
                            "AI анализ",
                            "Текстовый анализ через AI провайдера",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/insights", "AI анализ поведения пользователей")
                            )
                    ),
                    new EndpointGroup(
                            "Документация",
                            "Доступ к документации API",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI"),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате"),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов")
                            )
                    )
                )
        ));
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpointsResponse {
        private final String title;
        private final String description;
        private final String version;
        private final List<EndpointGroup> groups;
    }

    @Getter
    @RequiredArgsConstructor
    public static class EndpointGroup {
        private final String name;
        private final String description;
        private final List<ApiEndpoint> endpoints;
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpoint {
        private final String method;
        private final String path;
        private final String description;
    }
}
