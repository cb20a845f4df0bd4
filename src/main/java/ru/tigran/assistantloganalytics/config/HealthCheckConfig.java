package ru.tigran.assistantloganalytics.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;

/**
 * Конфигурация health checks
 */
@Configuration
public class HealthCheckConfig {

    /**
     * Показывает активный snapshot. Отсутствие данных не считается сбоем.
     */
    @Bean
    public HealthIndicator logSnapshotHealthIndicator(LogSnapshotStore snapshotStore) {
        return () -> snapshotStore.current()
                .map(snapshot -> Health.up()
                        .withDetail("snapshotId", snapshot.id())
                        .withDetail("fileName", snapshot.fileName())
                        .withDetail("records", snapshot.records().size())
                        .withDetail("ingestedAt", snapshot.ingestedAt().toString())
                        .build())
                .orElseGet(() -> Health.up()
                        .withDetail("status", "No log file ingested yet")
                        .build());
    }

    /**
     * Состояние CircuitBreaker AI провайдера, без сетевых запросов.
     * Открытый breaker понижает статус до OUT_OF_SERVICE: аналитика работает, AI анализ нет.
     */
    @Bean
    public HealthIndicator aiProviderHealthIndicator(@Qualifier("aiProviderCircuitBreaker") CircuitBreaker circuitBreaker) {
        return () -> {
            CircuitBreaker.State state = circuitBreaker.getState();
            Health.Builder builder = state == CircuitBreaker.State.OPEN ? Health.outOfService() : Health.up();
            return builder
                    .withDetail("circuitBreaker", state.name())
                    .withDetail("failureRate", circuitBreaker.getMetrics().getFailureRate())
                    .build();
        };
    }
}
