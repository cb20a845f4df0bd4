package ru.tigran.assistantloganalytics.service;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.publisher.PublisherProbe;
import ru.tigran.assistantloganalytics.exception.AIGatewayException;
import ru.tigran.assistantloganalytics.exception.ErrorCode;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для LogInsightService.
 * AI провайдер замокан, асинхронность проверяется через StepVerifier.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("LogInsightService unit тесты")
class LogInsightServiceTest {

    @Mock
    private AIGatewayService aiGatewayService;

    private MeterRegistry meterRegistry;
    private LogInsightService insightService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        insightService = new LogInsightService(aiGatewayService, 150, 5, 1, meterRegistry);
    }

    private static LogSnapshot snapshotOf(List<LogRecord> records) {
        return new LogSnapshot("snap-1", "logs.csv", Instant.now(), records.size(), records);
    }

    private static LogRecord question(String content, String company) {
        return LogRecord.builder()
                .content(content)
                .timestamp("2024-01-01 09:00:00")
                .userId("u1")
                .company(company)
                .build();
    }

    // ===== ВЫБОРКА =====

    @Test
    @DisplayName("sampleForInsight - первые 150 записей длиннее 5 символов")
    void sampleTakesFirstLongQuestions() {
        List<LogRecord> records = new ArrayList<>();
        records.add(question("你好", ""));
        records.add(question("12345", ""));
        for (int i = 0; i < 200; i++) {
            records.add(question("铜价格今天是多少 #" + i, ""));
        }

        List<LogRecord> sample = insightService.sampleForInsight(records);

        assertEquals(150, sample.size());
        assertEquals("铜价格今天是多少 #0", sample.get(0).content());
        assertEquals("铜价格今天是多少 #149", sample.get(149).content());
    }

    // ===== УСПЕШНЫЕ СЦЕНАРИИ =====

    @Test
    @DisplayName("generateInsight - HTML от провайдера возвращается как успешный ответ")
    void generateInsightSuccess() {
        when(aiGatewayService.isConfigured()).thenReturn(true);
        when(aiGatewayService.generateCompletionAsync(anyString(), anyString()))
                .thenReturn(Mono.just("<h3>用户画像</h3>"));

        LogSnapshot snapshot = snapshotOf(List.of(
                question("今天铜价格是多少", "某某贸易"),
                question("短", "")
        ));

        StepVerifier.create(insightService.generateInsight(snapshot))
                .assertNext(response -> {
                    assertEquals("snap-1", response.snapshotId());
                    assertEquals(1, response.sampleSize());
                    assertEquals("<h3>用户画像</h3>", response.html());
                    assertTrue(response.successful());
                })
                .verifyComplete();

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(aiGatewayService).generateCompletionAsync(anyString(), userPrompt.capture());
        assertTrue(userPrompt.getValue().contains("- [某某贸易] asked: \"今天铜价格是多少\""));
        assertEquals(1.0, meterRegistry.counter("logs.insight.completed").count());
    }

    // ===== ОШИБКИ =====

    @Test
    @DisplayName("generateInsight - без API ключа провайдер не вызывается")
    void generateInsightWithoutApiKey() {
        when(aiGatewayService.isConfigured()).thenReturn(false);

        StepVerifier.create(insightService.generateInsight(snapshotOf(List.of(question("今天铜价格是多少", "")))))
                .assertNext(response -> {
                    assertFalse(response.successful());
                    assertEquals(LogInsightService.API_KEY_MISSING_HTML, response.html());
                })
                .verifyComplete();

        verify(aiGatewayService, never()).generateCompletionAsync(anyString(), anyString());
    }

    @Test
    @DisplayName("generateInsight - ошибка провайдера превращается в разметку ошибки, а не в исключение")
    void generateInsightProviderFailure() {
        when(aiGatewayService.isConfigured()).thenReturn(true);
        when(aiGatewayService.generateCompletionAsync(anyString(), anyString()))
                .thenReturn(Mono.error(new AIGatewayException(ErrorCode.AI_SERVICE_ERROR, "down", true)));

        StepVerifier.create(insightService.generateInsight(snapshotOf(List.of(question("今天铜价格是多少", "")))))
                .assertNext(response -> {
                    assertFalse(response.successful());
                    assertEquals(LogInsightService.FAILURE_HTML, response.html());
                })
                .verifyComplete();

        assertEquals(1.0, meterRegistry.counter("logs.insight.failed").count());
    }

    @Test
    @DisplayName("generateInsight - таймаут провайдера дает разметку ошибки")
    void generateInsightTimeout() {
        when(aiGatewayService.isConfigured()).thenReturn(true);
        when(aiGatewayService.generateCompletionAsync(anyString(), anyString())).thenReturn(Mono.never());
        LogSnapshot snapshot = snapshotOf(List.of(question("今天铜价格是多少", "")));

        StepVerifier.withVirtualTime(() -> insightService.generateInsight(snapshot))
                .thenAwait(Duration.ofSeconds(2))
                .assertNext(response -> assertEquals(LogInsightService.FAILURE_HTML, response.html()))
                .verifyComplete();
    }

    @Test
    @DisplayName("generateInsight - отмена подписчиком отменяет вызов провайдера")
    void generateInsightCancellation() {
        PublisherProbe<String> providerCall = PublisherProbe.of(Mono.never());
        when(aiGatewayService.isConfigured()).thenReturn(true);
        when(aiGatewayService.generateCompletionAsync(anyString(), anyString())).thenReturn(providerCall.mono());

        StepVerifier.create(insightService.generateInsight(snapshotOf(List.of(question("今天铜价格是多少", "")))))
                .expectSubscription()
                .thenCancel()
                .verify();

        providerCall.assertWasSubscribed();
        providerCall.assertWasCancelled();
    }
}
