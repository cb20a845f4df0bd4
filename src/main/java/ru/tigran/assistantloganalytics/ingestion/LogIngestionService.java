package ru.tigran.assistantloganalytics.ingestion;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.assistantloganalytics.analytics.AnalyticsReportService;
import ru.tigran.assistantloganalytics.exception.ErrorCode;
import ru.tigran.assistantloganalytics.exception.IngestionInProgressException;
import ru.tigran.assistantloganalytics.exception.LogParseException;
import ru.tigran.assistantloganalytics.exception.ValidationException;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns an uploaded file into the active snapshot.
 *
 * Ingestion is all-or-nothing: the store is touched only after the whole file
 * has been read and normalized, so a parse failure keeps the previous snapshot.
 * Only one ingestion runs at a time; a concurrent upload is rejected rather than queued.
 */
@Slf4j
@Service
public class LogIngestionService {

    private final CsvLogReader csvLogReader;
    private final LogRecordNormalizer normalizer;
    private final LogSnapshotStore snapshotStore;
    private final AnalyticsReportService analyticsReportService;
    private final ReentrantLock ingestionLock = new ReentrantLock();
    private final Counter ingestionCompletedCounter;
    private final Counter ingestionFailedCounter;
    private final Counter droppedRowsCounter;
    private final Timer ingestionTimer;

    public LogIngestionService(
            CsvLogReader csvLogReader,
            LogRecordNormalizer normalizer,
            LogSnapshotStore snapshotStore,
            AnalyticsReportService analyticsReportService,
            MeterRegistry meterRegistry
    ) {
        this.csvLogReader = csvLogReader;
        this.normalizer = normalizer;
        this.snapshotStore = snapshotStore;
        this.analyticsReportService = analyticsReportService;
        this.ingestionCompletedCounter = Counter.builder("logs.ingestion.completed")
                .description("Log files ingested successfully")
                .register(meterRegistry);
        this.ingestionFailedCounter = Counter.builder("logs.ingestion.failed")
                .description("Log files rejected as unparseable")
                .register(meterRegistry);
        this.droppedRowsCounter = Counter.builder("logs.ingestion.rows.dropped")
                .description("Rows dropped for missing content or timestamp")
                .register(meterRegistry);
        this.ingestionTimer = Timer.builder("logs.ingestion.time")
                .description("Time to read and normalize a log file")
                .register(meterRegistry);
    }

    /**
     * Parses the file and makes the result the active snapshot.
     *
     * @param fileName original file name, kept for display
     * @param content  raw file bytes
     * @return the new active snapshot
     * @throws ValidationException          if the file is empty
     * @throws IngestionInProgressException if another ingestion is running
     * @throws LogParseException            if the file cannot be tokenized as CSV
     */
    public LogSnapshot ingest(String fileName, byte[] content) {
        if (content == null || content.length == 0) {
            throw new ValidationException(ErrorCode.EMPTY_FILE);
        }

        if (!ingestionLock.tryLock()) {
            log.warn("Rejected upload of '{}': another ingestion is running", fileName);
            throw new IngestionInProgressException();
        }

        try {
            return ingestionTimer.record(() -> executeIngest(fileName, content));
        } finally {
            ingestionLock.unlock();
        }
    }

    private LogSnapshot executeIngest(String fileName, byte[] content) {
        log.info("Ingesting log file '{}' ({} bytes)", fileName, content.length);

        List<Map<String, String>> rows;
        try {
            rows = csvLogReader.read(content);
        } catch (LogParseException e) {
            ingestionFailedCounter.increment();
            log.warn("Log file '{}' rejected, keeping previous snapshot: {}", fileName, e.getMessage());
            throw e;
        }

        List<LogRecord> records = normalizer.normalize(rows);
        LogSnapshot snapshot = new LogSnapshot(
                UUID.randomUUID().toString(),
                fileName,
                Instant.now(),
                rows.size(),
                records
        );

        snapshotStore.replace(snapshot).ifPresent(previous ->
                log.debug("Snapshot {} replaced by {}", previous.id(), snapshot.id()));
        analyticsReportService.evictReports();

        ingestionCompletedCounter.increment();
        droppedRowsCounter.increment(snapshot.droppedRows());
        log.info("Snapshot {} active: {} records kept, {} rows dropped",
                snapshot.id(), records.size(), snapshot.droppedRows());
        return snapshot;
    }
}
