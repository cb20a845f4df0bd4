package ru.tigran.assistantloganalytics.exception;

/**
 * Body of every error reply produced by {@link GlobalExceptionHandler}.
 */
public record ErrorResponse(String errorCode, String message) {
}
