package ru.tigran.assistantloganalytics.exception;

/**
 * Transient provider status (429, 502, 503, 504) inside the retry loop.
 * Never leaves {@code AIGatewayService}: exhausted retries are rethrown as {@link AIGatewayException}.
 */
public class RetriableHttpException extends RuntimeException {
    public RetriableHttpException(int status, String provider) {
        super(provider + " answered " + status);
    }
}
