package ru.tigran.assistantloganalytics.exception;

/**
 * Root of the errors this service reports to clients.
 *
 * Each instance carries an {@link ErrorCode}; {@link GlobalExceptionHandler} turns the code
 * into the HTTP status and the {@code errorCode} field of the error body.
 * A retriable error means the same request may succeed later without changes
 * (another upload finished, the AI provider recovered).
 */
public abstract class ApplicationException extends RuntimeException {
    private final ErrorCode code;
    private final boolean retriable;

    protected ApplicationException(ErrorCode code) {
        this(code, code.getDefaultMessage(), false, null);
    }

    protected ApplicationException(ErrorCode code, String message) {
        this(code, message, false, null);
    }

    protected ApplicationException(ErrorCode code, String message, boolean retriable, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retriable = retriable;
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * @return wire representation of the code, as sent in {@link ErrorResponse}
     */
    public String getErrorCode() {
        return code.getCode();
    }

    public boolean isRetriable() {
        return retriable;
    }
}
