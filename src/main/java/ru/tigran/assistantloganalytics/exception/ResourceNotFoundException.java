package ru.tigran.assistantloganalytics.exception;

/**
 * Requested data does not exist yet, e.g. analytics before the first ingestion.
 * HTTP status: 404 Not Found
 */
public class ResourceNotFoundException extends ApplicationException {
    public ResourceNotFoundException(ErrorCode code) {
        super(code);
    }
}
