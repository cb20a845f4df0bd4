package ru.tigran.assistantloganalytics.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;
import ru.tigran.assistantloganalytics.exception.AIGatewayException;
import ru.tigran.assistantloganalytics.exception.ErrorCode;
import ru.tigran.assistantloganalytics.exception.RetriableHttpException;

import java.time.Duration;
import java.util.Set;

/**
 * Client for OpenAI-compatible chat-completion providers (OpenRouter, AgentRouter).
 *
 * All calls are non-blocking: the returned Mono performs the HTTP request on subscription
 * and aborts it when the subscriber cancels.
 */
@Slf4j
@Service
public class AIGatewayService {

    private static final String OPENROUTER_API_URL = "https://openrouter.ai/api/v1/chat/completions";
    private static final String AGENTROUTER_API_URL = "https://api.agentrouter.ai/v1/chat/completions";
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(429, 502, 503, 504);
    // 1 MB
    private static final int MAX_RESPONSE_CHARS = 1024 * 1024;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker aiProviderCircuitBreaker;
    private final ProviderEndpoint endpoint;
    private final String openRouterPreset;
    private final Retry transientErrorRetry;
    private final Duration requestTimeout;

    public AIGatewayService(
            WebClient webClient,
            ObjectMapper objectMapper,
            @Qualifier("aiProviderCircuitBreaker") CircuitBreaker aiProviderCircuitBreaker,
            @Value("${app.ai.provider:openrouter}") String provider,
            @Value("${app.openrouter.api-key:}") String openRouterApiKey,
            @Value("${app.openrouter.model:google/gemini-2.5-flash}") String openRouterModel,
            @Value("${app.openrouter.preset-insight:}") String openRouterPreset,
            @Value("${app.agentrouter.api-key:}") String agentRouterApiKey,
            @Value("${app.agentrouter.model:gpt-4o-mini}") String agentRouterModel,
            @Value("${app.ai.retry-delay-ms:500}") long retryDelayMs,
            @Value("${app.ai.max-retries:3}") int maxRetries,
            @Value("${app.ai.request-timeout-seconds:30}") long requestTimeoutSeconds
    ) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.aiProviderCircuitBreaker = aiProviderCircuitBreaker;
        this.endpoint = "agentrouter".equalsIgnoreCase(provider)
                ? new ProviderEndpoint("agentrouter", AGENTROUTER_API_URL, agentRouterApiKey, agentRouterModel)
                : new ProviderEndpoint("openrouter", OPENROUTER_API_URL, openRouterApiKey, openRouterModel);
        this.openRouterPreset = endpoint.isOpenRouter() ? openRouterPreset : null;
        this.requestTimeout = Duration.ofSeconds(requestTimeoutSeconds);
        this.transientErrorRetry = Retry.backoff(maxRetries, Duration.ofMillis(retryDelayMs))
                .filter(RetriableHttpException.class::isInstance)
                .doBeforeRetry(signal -> log.info("{}, retry {}/{}",
                        signal.failure().getMessage(), signal.totalRetries() + 1, maxRetries))
                .onRetryExhaustedThrow((retrySpec, signal) -> new AIGatewayException(
                        ErrorCode.AI_SERVICE_ERROR,
                        endpoint.name() + " still failing after " + maxRetries + " retries",
                        true,
                        signal.failure()
                ));

        log.info("AI provider: {} (model {}, key {})", endpoint.name(), endpoint.model(),
                isConfigured() ? "configured" : "missing");
    }

    /**
     * @return true if an API key is configured for the active provider
     */
    public boolean isConfigured() {
        return endpoint.apiKey() != null && !endpoint.apiKey().isBlank();
    }

    /**
     * Sends one chat completion request.
     *
     * Statuses 429, 502, 503 and 504 are retried with exponential backoff up to
     * {@code app.ai.max-retries} times; other error statuses fail immediately.
     * Calls pass through the {@code aiProvider} circuit breaker.
     *
     * @param systemPrompt instructions for the model, may be blank
     * @param userMessage  the data to analyse
     * @return Mono with the message content, markdown fences removed;
     *         fails with {@link AIGatewayException} only
     */
    public Mono<String> generateCompletionAsync(String systemPrompt, String userMessage) {
        return Mono.fromCallable(() -> buildRequestBody(systemPrompt, userMessage))
                .flatMap(body -> webClient.post()
                        .uri(endpoint.url())
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + endpoint.apiKey())
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .exchangeToMono(this::readBody)
                        .timeout(requestTimeout))
                .retryWhen(transientErrorRetry)
                .map(this::extractMessageContent)
                .transformDeferred(CircuitBreakerOperator.of(aiProviderCircuitBreaker))
                .doOnNext(content -> log.info("Received {} chars from {}", content.length(), endpoint.name()))
                .onErrorMap(error -> !(error instanceof AIGatewayException), error -> new AIGatewayException(
                        ErrorCode.AI_SERVICE_ERROR,
                        endpoint.name() + " call failed: " + error.getMessage(),
                        false,
                        error
                ));
    }

    private Mono<String> readBody(ClientResponse response) {
        int status = response.statusCode().value();

        if (TRANSIENT_STATUSES.contains(status)) {
            log.warn("{} answered {}, will retry", endpoint.name(), status);
            return response.releaseBody()
                    .then(Mono.<String>error(new RetriableHttpException(status, endpoint.name())));
        }
        if (status >= 400) {
            log.error("{} answered {}", endpoint.name(), status);
            return response.releaseBody()
                    .then(Mono.<String>error(new AIGatewayException(
                            ErrorCode.AI_SERVICE_ERROR,
                            endpoint.name() + " answered " + status,
                            false
                    )));
        }
        return response.bodyToMono(String.class).defaultIfEmpty("");
    }

    /**
     * OpenAI-compatible body: model, optional system message, user message,
     * plus the OpenRouter preset when one is configured.
     */
    private String buildRequestBody(String systemPrompt, String userMessage) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", endpoint.model());

        ArrayNode messages = root.putArray("messages");
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.addObject().put("role", "system").put("content", systemPrompt);
        }
        messages.addObject().put("role", "user").put("content", userMessage);

        if (openRouterPreset != null && !openRouterPreset.isBlank()) {
            root.put("preset", openRouterPreset);
        }
        return objectMapper.writeValueAsString(root);
    }

    /**
     * Reads {@code /choices/0/message/content} from the provider response.
     */
    private String extractMessageContent(String response) {
        if (response == null || response.isEmpty()) {
            throw invalidResponse("Empty response", null);
        }
        if (response.length() > MAX_RESPONSE_CHARS) {
            throw invalidResponse("Response of " + response.length() + " chars exceeds " + MAX_RESPONSE_CHARS, null);
        }

        JsonNode content;
        try {
            content = objectMapper.readTree(response).at("/choices/0/message/content");
        } catch (JsonProcessingException e) {
            throw invalidResponse("Response is not JSON: " + e.getOriginalMessage(), e);
        }

        if (content.isMissingNode() || content.isNull()) {
            log.error("No message content in response: {}",
                    response.length() > 200 ? response.substring(0, 200) : response);
            throw invalidResponse("Response has no message content", null);
        }
        return cleanMarkdownCodeBlocks(content.asText());
    }

    private AIGatewayException invalidResponse(String message, Throwable cause) {
        return new AIGatewayException(ErrorCode.INVALID_AI_RESPONSE, endpoint.name() + ": " + message, false, cause);
    }

    /**
     * Removes markdown code fences (```html ... ``` or ``` ... ```) that models add
     * despite being asked for raw output.
     */
    static String cleanMarkdownCodeBlocks(String content) {
        if (content == null || content.isEmpty()) {
            return content;
        }

        String cleaned = content.trim();
        if (cleaned.startsWith("```")) {
            // opening fence line with its language tag
            int lineEnd = cleaned.indexOf('\n');
            cleaned = lineEnd < 0 ? cleaned.substring(3) : cleaned.substring(lineEnd + 1);
        }
        return cleaned.replace("```html", "").replace("```", "").trim();
    }

    private record ProviderEndpoint(String name, String url, String apiKey, String model) {
        boolean isOpenRouter() {
            return "openrouter".equals(name);
        }
    }
}
