package ru.tigran.assistantloganalytics.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import ru.tigran.assistantloganalytics.exception.ErrorCode;
import ru.tigran.assistantloganalytics.exception.IngestionInProgressException;
import ru.tigran.assistantloganalytics.exception.LogParseException;
import ru.tigran.assistantloganalytics.exception.ResourceNotFoundException;
import ru.tigran.assistantloganalytics.exception.ValidationException;
import ru.tigran.assistantloganalytics.ingestion.LogIngestionService;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;
import ru.tigran.assistantloganalytics.model.LogRecord;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Модульные тесты для LogIngestionController.
 * Использует @WebMvcTest для изоляции слоев.
 */
@WebMvcTest(LogIngestionController.class)
@AutoConfigureMockMvc(addFilters = false)
@DisplayName("LogIngestionController модульные тесты")
class LogIngestionControllerTest {

    private static final String LOGS_URL = "/api/v1/logs";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private LogIngestionService logIngestionService;

    @MockBean
    private LogSnapshotStore snapshotStore;

    private static MockMultipartFile csvFile(String content) {
        return new MockMultipartFile("file", "logs.csv", "text/csv", content.getBytes(StandardCharsets.UTF_8));
    }

    private static LogSnapshot snapshot() {
        return new LogSnapshot("snap-1", "logs.csv", Instant.parse("2024-03-01T10:00:00Z"), 3, List.of(
                LogRecord.builder().content("铜价").timestamp("2024-03-01 09:00:00").build(),
                LogRecord.builder().content("铝价").timestamp("2024-03-01 10:00:00").build()
        ));
    }

    @Test
    @DisplayName("POST /logs - успешная загрузка возвращает 201 и метаданные снимка")
    void uploadSuccess() throws Exception {
        when(logIngestionService.ingest(eq("logs.csv"), any(byte[].class))).thenReturn(snapshot());

        mockMvc.perform(multipart(LOGS_URL).file(csvFile("问题ID,问题内容,提问时间\n")))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.snapshotId", equalTo("snap-1")))
                .andExpect(jsonPath("$.fileName", equalTo("logs.csv")))
                .andExpect(jsonPath("$.totalRows", equalTo(3)))
                .andExpect(jsonPath("$.acceptedRecords", equalTo(2)))
                .andExpect(jsonPath("$.droppedRows", equalTo(1)))
                .andExpect(jsonPath("$.ingestedAt", notNullValue()));
    }

    @Test
    @DisplayName("POST /logs - без части file возвращает 400")
    void uploadWithoutFilePart() throws Exception {
        mockMvc.perform(multipart(LOGS_URL))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", equalTo("VALIDATION_ERROR")));

        verifyNoInteractions(logIngestionService);
    }

    @Test
    @DisplayName("POST /logs - пустой файл возвращает 400 EMPTY_FILE")
    void uploadEmptyFile() throws Exception {
        when(logIngestionService.ingest(anyString(), any(byte[].class))).thenThrow(new ValidationException(ErrorCode.EMPTY_FILE));

        mockMvc.perform(multipart(LOGS_URL).file(csvFile("")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode", equalTo("EMPTY_FILE")));
    }

    @Test
    @DisplayName("POST /logs - нечитаемый файл возвращает 422")
    void uploadUnparseableFile() throws Exception {
        when(logIngestionService.ingest(anyString(), any(byte[].class)))
                .thenThrow(new LogParseException("File is not valid UTF-8 text"));

        mockMvc.perform(multipart(LOGS_URL).file(csvFile("garbage")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errorCode", equalTo("LOG_PARSE_ERROR")))
                .andExpect(jsonPath("$.message", containsString("UTF-8")));
    }

    @Test
    @DisplayName("POST /logs - параллельная загрузка возвращает 409")
    void uploadWhileIngesting() throws Exception {
        when(logIngestionService.ingest(anyString(), any(byte[].class)))
                .thenThrow(new IngestionInProgressException());

        mockMvc.perform(multipart(LOGS_URL).file(csvFile("问题ID\n")))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode", equalTo("INGESTION_IN_PROGRESS")));
    }

    @Test
    @DisplayName("GET /logs/current - метаданные активного снимка")
    void currentSnapshot() throws Exception {
        when(snapshotStore.require()).thenReturn(snapshot());

        mockMvc.perform(get(LOGS_URL + "/current"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.snapshotId", equalTo("snap-1")));
    }

    @Test
    @DisplayName("GET /logs/current - до первой загрузки возвращает 404")
    void currentSnapshotBeforeIngest() throws Exception {
        when(snapshotStore.require()).thenThrow(new ResourceNotFoundException(ErrorCode.NO_DATA_INGESTED));

        mockMvc.perform(get(LOGS_URL + "/current"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode", equalTo("NO_DATA_INGESTED")));
    }
}
