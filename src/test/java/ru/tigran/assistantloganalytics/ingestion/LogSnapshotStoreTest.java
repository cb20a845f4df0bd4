package ru.tigran.assistantloganalytics.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.assistantloganalytics.exception.ResourceNotFoundException;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogSnapshotStore unit тесты")
class LogSnapshotStoreTest {

    private final LogSnapshotStore store = new LogSnapshotStore();

    @Test
    @DisplayName("require - до первой загрузки выбрасывает ResourceNotFoundException")
    void requireBeforeIngestFails() {
        ResourceNotFoundException exception = assertThrows(ResourceNotFoundException.class, store::require);

        assertEquals("NO_DATA_INGESTED", exception.getErrorCode());
    }

    @Test
    @DisplayName("replace - возвращает замененный снимок")
    void replaceReturnsPrevious() {
        LogSnapshot first = new LogSnapshot("s1", "a.csv", Instant.now(), 0, List.of());
        LogSnapshot second = new LogSnapshot("s2", "b.csv", Instant.now(), 0, List.of());

        assertTrue(store.replace(first).isEmpty());
        assertSame(first, store.replace(second).orElseThrow());
        assertSame(second, store.require());
    }
}
