package ru.tigran.assistantloganalytics.exception;

/**
 * Rejected request input, e.g. an empty upload.
 * HTTP status: 400 Bad Request
 */
public class ValidationException extends ApplicationException {
    public ValidationException(ErrorCode code) {
        super(code);
    }

    public ValidationException(ErrorCode code, String message) {
        super(code, message);
    }
}
