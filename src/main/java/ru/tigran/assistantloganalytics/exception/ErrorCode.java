package ru.tigran.assistantloganalytics.exception;

/**
 * Machine-readable error codes sent in {@link ErrorResponse#errorCode()}.
 * The default message is used when the thrower has nothing more specific to say.
 */
public enum ErrorCode {
    // загрузка
    LOG_PARSE_ERROR("LOG_PARSE_ERROR", "Uploaded file cannot be parsed as CSV"),
    EMPTY_FILE("EMPTY_FILE", "Uploaded file is empty"),
    FILE_TOO_LARGE("FILE_TOO_LARGE", "Uploaded file exceeds the size limit"),
    INGESTION_IN_PROGRESS("INGESTION_IN_PROGRESS", "Another log file is being ingested"),

    // чтение
    NO_DATA_INGESTED("NO_DATA_INGESTED", "No log file has been ingested yet"),
    VALIDATION_ERROR("VALIDATION_ERROR", "Request is missing required input"),

    // AI провайдер
    AI_SERVICE_ERROR("AI_SERVICE_ERROR", "AI provider call failed"),
    INVALID_AI_RESPONSE("INVALID_AI_RESPONSE", "AI provider returned an unreadable response"),

    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "An unexpected error occurred");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String message) {
        this.code = code;
        this.defaultMessage = message;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
