package ru.tigran.assistantloganalytics.exception;

/**
 * Failure of a chat-completion call: error status, exhausted retries,
 * open circuit breaker or an unreadable response body.
 *
 * The insight endpoint converts it into failure markup, so it reaches
 * the HTTP layer only when some other caller lets it escape.
 */
public class AIGatewayException extends ApplicationException {
    public AIGatewayException(ErrorCode code, String message, boolean retriable) {
        super(code, message, retriable, null);
    }

    public AIGatewayException(ErrorCode code, String message, boolean retriable, Throwable cause) {
        super(code, message, retriable, cause);
    }
}
