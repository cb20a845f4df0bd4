package ru.tigran.assistantloganalytics.ingestion;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.exception.ErrorCode;
import ru.tigran.assistantloganalytics.exception.ResourceNotFoundException;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single active snapshot in memory.
 * Readers always see either the previous or the new snapshot, never a mix.
 */
@Component
public class LogSnapshotStore {

    private final AtomicReference<LogSnapshot> active = new AtomicReference<>();

    public Optional<LogSnapshot> current() {
        return Optional.ofNullable(active.get());
    }

    /**
     * Returns the active snapshot.
     *
     * @throws ResourceNotFoundException if nothing has been ingested yet
     */
    public LogSnapshot require() {
        return current().orElseThrow(() -> new ResourceNotFoundException(ErrorCode.NO_DATA_INGESTED));
    }

    /**
     * Makes the given snapshot active.
     *
     * @return the snapshot it replaced, if any
     */
    public Optional<LogSnapshot> replace(LogSnapshot snapshot) {
        return Optional.ofNullable(active.getAndSet(snapshot));
    }
}
