package ru.tigran.assistantloganalytics.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * Web конфигурация: CORS для dashboard фронтенда и журнал запросов
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${cors.allowed-origins:http://localhost:3000,http://localhost:5173}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // загрузка CSV и чтение аналитики
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "OPTIONS")
                .allowedHeaders("*")
                .maxAge(3600);

        // health виджет на dashboard
        registry.addMapping("/actuator/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET")
                .maxAge(3600);
    }

    @Bean
    public OncePerRequestFilter requestLoggingFilter(
            @Value("${app.web.slow-request-ms:1000}") long slowRequestMs
    ) {
        return new RequestLoggingFilter(slowRequestMs);
    }

    /**
     * Пишет метод, путь, статус и длительность каждого запроса к API.
     * Ошибки клиента и сервера на WARN, медленные запросы на INFO, остальное на DEBUG.
     */
    static class RequestLoggingFilter extends OncePerRequestFilter {

        private final long slowRequestMs;

        RequestLoggingFilter(long slowRequestMs) {
            this.slowRequestMs = slowRequestMs;
        }

        @Override
        protected boolean shouldNotFilter(HttpServletRequest request) {
            return request.getRequestURI().startsWith("/actuator");
        }

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain
        ) throws ServletException, IOException {
            long started = System.nanoTime();
            try {
                filterChain.doFilter(request, response);
            } finally {
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
                int status = response.getStatus();
                String line = request.getMethod() + " " + request.getRequestURI();

                if (status >= 400) {
                    log.warn("{} -> {} in {}ms", line, status, elapsedMs);
                } else if (elapsedMs > slowRequestMs) {
                    log.info("{} -> {} in {}ms (slow)", line, status, elapsedMs);
                } else {
                    log.debug("{} -> {} in {}ms", line, status, elapsedMs);
                }
            }
        }
    }
}
