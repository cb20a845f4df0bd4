package ru.tigran.assistantloganalytics.exception;

import org.springframework.http.HttpStatus;

/**
 * HTTP status and log level for an {@link ApplicationException}, derived from its code.
 * Client mistakes log at WARN, server-side failures at ERROR with the stack trace.
 */
record ExceptionInfo(HttpStatus status, boolean shouldLogError) {

    static ExceptionInfo forException(ApplicationException exception) {
        return switch (exception.getCode()) {
            case EMPTY_FILE, VALIDATION_ERROR -> new ExceptionInfo(HttpStatus.BAD_REQUEST, false);
            case NO_DATA_INGESTED -> new ExceptionInfo(HttpStatus.NOT_FOUND, false);
            case INGESTION_IN_PROGRESS -> new ExceptionInfo(HttpStatus.CONFLICT, false);
            case FILE_TOO_LARGE -> new ExceptionInfo(HttpStatus.PAYLOAD_TOO_LARGE, false);
            case LOG_PARSE_ERROR -> new ExceptionInfo(HttpStatus.UNPROCESSABLE_ENTITY, false);
            case AI_SERVICE_ERROR, INVALID_AI_RESPONSE -> new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
            case INTERNAL_SERVER_ERROR -> new ExceptionInfo(HttpStatus.INTERNAL_SERVER_ERROR, true);
        };
    }
}
