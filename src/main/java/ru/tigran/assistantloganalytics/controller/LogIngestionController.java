package ru.tigran.assistantloganalytics.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import ru.tigran.assistantloganalytics.dto.IngestionResponse;
import ru.tigran.assistantloganalytics.exception.LogParseException;
import ru.tigran.assistantloganalytics.ingestion.LogIngestionService;
import ru.tigran.assistantloganalytics.ingestion.LogSnapshotStore;
import ru.tigran.assistantloganalytics.model.LogSnapshot;

import java.io.IOException;

@Slf4j
@RestController
@RequestMapping("/api/v1/logs")
@Tag(name = "Log Ingestion", description = "Загрузка CSV выгрузки логов AI ассистента")
public class LogIngestionController {

    private final LogIngestionService logIngestionService;
    private final LogSnapshotStore snapshotStore;

    public LogIngestionController(LogIngestionService logIngestionService, LogSnapshotStore snapshotStore) {
        this.logIngestionService = logIngestionService;
        this.snapshotStore = snapshotStore;
    }

    /**
     * Uploads a CSV export and makes it the active data set.
     * The previous data set stays active if the file cannot be parsed.
     *
     * @param file CSV file with the localized column headers
     * @return metadata of the new snapshot
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(
            summary = "Загрузить CSV файл логов",
            description = "Парсит файл, отбрасывает строки без содержания вопроса или времени " +
                    "и полностью заменяет текущий набор данных. Одновременно обрабатывается только одна загрузка."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Файл загружен, новый набор данных активен",
                    content = @Content(schema = @Schema(implementation = IngestionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустой файл или отсутствует часть 'file'"),
            @ApiResponse(responseCode = "409", description = "Другая загрузка еще выполняется"),
            @ApiResponse(responseCode = "413", description = "Файл превышает допустимый размер"),
            @ApiResponse(responseCode = "422", description = "Файл не является корректным CSV в UTF-8")
    })
    public ResponseEntity<IngestionResponse> uploadLogs(
            @RequestPart("file")
            @Parameter(description = "CSV выгрузка логов")
            MultipartFile file
    ) {
        log.info("POST /api/v1/logs - file: {}, size: {}", file.getOriginalFilename(), file.getSize());

        byte[] content;
        try {
            content = file.getBytes();
        } catch (IOException e) {
            throw new LogParseException("Failed to read uploaded file", e);
        }

        LogSnapshot snapshot = logIngestionService.ingest(file.getOriginalFilename(), content);
        return ResponseEntity.status(HttpStatus.CREATED).body(IngestionResponse.from(snapshot));
    }

    @GetMapping("/current")
    @Operation(summary = "Метаданные текущего набора данных")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Активный набор данных"),
            @ApiResponse(responseCode = "404", description = "Данные еще не загружались")
    })
    public ResponseEntity<IngestionResponse> getCurrentSnapshot() {
        return ResponseEntity.ok(IngestionResponse.from(snapshotStore.require()));
    }
}
