package ru.tigran.assistantloganalytics.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j: CircuitBreaker для AI провайдера.
 * Аналитика от него не зависит, breaker защищает только AI анализ.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * Окно из последних вызовов; при доле ошибок или медленных вызовов выше порога breaker открывается
     * и через wait-duration переходит в HALF_OPEN.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
            @Value("${app.ai.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${app.ai.circuit-breaker.sliding-window-size:10}") int slidingWindowSize,
            @Value("${app.ai.circuit-breaker.minimum-calls:5}") int minimumCalls,
            @Value("${app.ai.circuit-breaker.wait-seconds:20}") long waitSeconds,
            // генерация анализа по 150 вопросам может идти больше минуты
            @Value("${app.ai.circuit-breaker.slow-call-seconds:60}") long slowCallSeconds
    ) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(minimumCalls)
                .failureRateThreshold(failureRateThreshold)
                .slowCallRateThreshold(failureRateThreshold)
                .slowCallDurationThreshold(Duration.ofSeconds(slowCallSeconds))
                .waitDurationInOpenState(Duration.ofSeconds(waitSeconds))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker '{}' registered", event.getAddedEntry().getName()));
        return registry;
    }

    @Bean
    public CircuitBreaker aiProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("aiProvider");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("AI provider breaker {}", event.getStateTransition()))
                .onCallNotPermitted(event -> log.warn("AI provider call rejected, breaker is open"))
                .onError(event -> log.debug("AI provider breaker recorded {}", event.getThrowable().toString()));

        return circuitBreaker;
    }
}
