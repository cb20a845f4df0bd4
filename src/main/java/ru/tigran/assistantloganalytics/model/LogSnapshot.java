package ru.tigran.assistantloganalytics.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of one successful ingestion: the normalized record
 * collection plus metadata about the file it came from.
 *
 * A snapshot is never modified; the next upload replaces it wholesale.
 *
 * @param id         random identifier, also used as the report cache key
 * @param fileName   original name of the uploaded file
 * @param ingestedAt moment the snapshot became active
 * @param totalRows  number of data rows read from the file, before filtering
 * @param records    rows that survived normalization, in file order
 */
public record LogSnapshot(
        String id,
        String fileName,
        Instant ingestedAt,
        int totalRows,
        List<LogRecord> records
) {
    public LogSnapshot {
        records = List.copyOf(records);
    }

    public int droppedRows() {
        return totalRows - records.size();
    }
}
