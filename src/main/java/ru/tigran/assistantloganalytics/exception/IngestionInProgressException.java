package ru.tigran.assistantloganalytics.exception;

/**
 * An upload arrived while another ingestion is still running. The client may retry.
 * HTTP status: 409 Conflict
 */
public class IngestionInProgressException extends ApplicationException {
    public IngestionInProgressException() {
        super(ErrorCode.INGESTION_IN_PROGRESS, ErrorCode.INGESTION_IN_PROGRESS.getDefaultMessage(), true, null);
    }
}
