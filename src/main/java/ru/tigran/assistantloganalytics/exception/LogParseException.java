package ru.tigran.assistantloganalytics.exception;

/**
 * An uploaded file cannot be tokenized as delimited text at all:
 * invalid UTF-8, an unterminated quoted field, or no header row.
 *
 * Row-level defects never raise this exception; such rows are filtered.
 * HTTP status: 422 Unprocessable Entity
 */
public class LogParseException extends ApplicationException {
    public LogParseException(String message) {
        super(ErrorCode.LOG_PARSE_ERROR, message);
    }

    public LogParseException(String message, Throwable cause) {
        super(ErrorCode.LOG_PARSE_ERROR, message, false, cause);
    }
}
