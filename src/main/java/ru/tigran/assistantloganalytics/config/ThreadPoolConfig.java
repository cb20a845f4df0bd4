package ru.tigran.assistantloganalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Конфигурация thread pool для параллельного расчета аналитических представлений
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * Executor для расчета представлений отчета.
     * При переполнении очереди задача выполняется в вызывающем потоке, чтобы отчет всегда был собран.
     */
    @Bean(name = "analyticsExecutor")
    public Executor analyticsExecutor(
            @Value("${app.analytics.executor.core-pool-size:4}") int corePoolSize,
            @Value("${app.analytics.executor.max-pool-size:8}") int maxPoolSize,
            @Value("${app.analytics.executor.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("analytics-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setRejectedExecutionHandler((r, exec) -> {
            log.warn("Analytics task queue is full, running task in caller thread");
            new ThreadPoolExecutor.CallerRunsPolicy().rejectedExecution(r, exec);
        });
        executor.initialize();

        return executor;
    }
}
