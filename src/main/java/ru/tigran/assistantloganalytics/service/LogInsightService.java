package ru.tigran.assistantloganalytics.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import ru.tigran.assistantloganalytics.dto.InsightResponse;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Duration;
import java.util.List;

/**
 * Generates the AI narrative analysis of a snapshot.
 *
 * Best effort: any failure of the provider ends in failure markup with
 * {@code successful=false}, never in an error signal, so the numeric analytics
 * are unaffected. The returned Mono can be cancelled by the caller.
 */
@Slf4j
@Service
public class LogInsightService {

    static final String FAILURE_HTML = "<p class='text-red-500'>生成 AI 分析时出错，请检查控制台。</p>";
    static final String API_KEY_MISSING_HTML =
            "<p class='text-red-500'>API Key missing. Please configure environment variables.</p>";

    private final AIGatewayService aiGatewayService;
    private final int sampleSize;
    private final int minContentLength;
    private final Duration insightTimeout;
    private final Counter insightCompletedCounter;
    private final Counter insightFailedCounter;

    public LogInsightService(
            AIGatewayService aiGatewayService,
            @Value("${app.insight.sample-size:150}") int sampleSize,
            @Value("${app.insight.min-content-length:5}") int minContentLength,
            @Value("${app.insight.timeout-seconds:90}") long timeoutSeconds,
            MeterRegistry meterRegistry
    ) {
        this.aiGatewayService = aiGatewayService;
        this.sampleSize = sampleSize;
        this.minContentLength = minContentLength;
        this.insightTimeout = Duration.ofSeconds(timeoutSeconds);
        this.insightCompletedCounter = Counter.builder("logs.insight.completed")
                .description("AI insight analyses completed")
                .register(meterRegistry);
        this.insightFailedCounter = Counter.builder("logs.insight.failed")
                .description("AI insight analyses that ended in failure markup")
                .register(meterRegistry);
    }

    /**
     * Picks the records handed to the AI provider: the first {@code sample-size}
     * records whose content is longer than {@code min-content-length} characters.
     */
    public List<LogRecord> sampleForInsight(List<LogRecord> records) {
        return records.stream()
                .filter(record -> record.content().length() > minContentLength)
                .limit(sampleSize)
                .toList();
    }

    public Mono<InsightResponse> generateInsight(LogSnapshot snapshot) {
        List<LogRecord> sample = sampleForInsight(snapshot.records());

        if (!aiGatewayService.isConfigured()) {
            log.warn("AI API key is not set, insight analysis is disabled");
            insightFailedCounter.increment();
            return Mono.just(new InsightResponse(snapshot.id(), sample.size(), API_KEY_MISSING_HTML, false));
        }

        log.info("Requesting AI insight for snapshot {} with {} sampled records", snapshot.id(), sample.size());

        return aiGatewayService.generateCompletionAsync(
                        InsightPromptBuilder.buildSystemPrompt(),
                        InsightPromptBuilder.buildUserPrompt(sample))
                .timeout(insightTimeout)
                .map(html -> new InsightResponse(snapshot.id(), sample.size(), html, true))
                .doOnNext(response -> insightCompletedCounter.increment())
                .onErrorResume(error -> {
                    log.error("AI insight generation failed for snapshot {}", snapshot.id(), error);
                    insightFailedCounter.increment();
                    return Mono.just(new InsightResponse(snapshot.id(), sample.size(), FAILURE_HTML, false));
                })
                .doOnCancel(() -> log.info("AI insight for snapshot {} cancelled by caller", snapshot.id()));
    }
}
