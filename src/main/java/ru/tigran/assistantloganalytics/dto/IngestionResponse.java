package ru.tigran.assistantloganalytics.dto;

import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Instant;

/**
 * Metadata of the active snapshot, returned after an upload.
 *
 * @param snapshotId      id of the snapshot now active
 * @param fileName        original file name
 * @param ingestedAt      moment the snapshot became active
 * @param totalRows       data rows read from the file
 * @param acceptedRecords rows kept after normalization
 * @param droppedRows     rows without content or timestamp
 */
public record IngestionResponse(
        String snapshotId,
        String fileName,
        Instant ingestedAt,
        int totalRows,
        int acceptedRecords,
        int droppedRows
) {
    public static IngestionResponse from(LogSnapshot snapshot) {
        return new IngestionResponse(
                snapshot.id(),
                snapshot.fileName(),
                snapshot.ingestedAt(),
                snapshot.totalRows(),
                snapshot.records().size(),
                snapshot.droppedRows()
        );
    }
}
