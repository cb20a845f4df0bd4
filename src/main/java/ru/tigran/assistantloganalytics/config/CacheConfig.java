package ru.tigran.assistantloganalytics.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.assistantloganalytics.analytics.AnalyticsReportService;

@Configuration
@EnableCaching
public class CacheConfig {

    /**
     * In-memory cache manager. Snapshots live in memory too, so there is nothing to share across instances.
     * Null values are not cached.
     */
    @Bean
    public CacheManager cacheManager() {
        ConcurrentMapCacheManager cacheManager = new ConcurrentMapCacheManager(AnalyticsReportService.REPORT_CACHE);
        cacheManager.setAllowNullValues(false);
        return cacheManager;
    }
}
