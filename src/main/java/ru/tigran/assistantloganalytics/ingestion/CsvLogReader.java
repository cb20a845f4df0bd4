package ru.tigran.assistantloganalytics.ingestion;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvMalformedLineException;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.exception.LogParseException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tokenizes an uploaded CSV export into header-keyed rows.
 *
 * The first non-blank line is the header. Blank lines are skipped, short rows
 * simply lack the trailing columns, and cells beyond the header are ignored.
 * A malformed line (an unterminated quote) ends reading; rows before it are kept.
 * Only input that cannot be decoded, or yields no header, raises {@link LogParseException}.
 */
@Slf4j
@Component
public class CsvLogReader {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads all data rows of the file.
     *
     * @param content raw file bytes, UTF-8
     * @return rows in file order, each mapping header to raw cell value
     * @throws LogParseException if the bytes are not valid UTF-8 or there is no header
     */
    public List<Map<String, String>> read(byte[] content) {
        String text = decode(content);

        try (CSVReader reader = new CSVReaderBuilder(new StringReader(text))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            String[] header = null;
            List<Map<String, String>> rows = new ArrayList<>();

            String[] line;
            while ((line = nextLine(reader)) != null) {
                if (isBlank(line)) {
                    continue;
                }
                if (header == null) {
                    header = trimAll(line);
                    continue;
                }
                rows.add(toRow(header, line));
            }

            if (header == null) {
                throw new LogParseException("CSV file has no header row");
            }

            log.debug("Read {} data rows with {} columns", rows.size(), header.length);
            return rows;
        } catch (IOException | CsvValidationException e) {
            throw new LogParseException("Failed to tokenize CSV: " + e.getMessage(), e);
        }
    }

    private static String[] nextLine(CSVReader reader) throws IOException, CsvValidationException {
        try {
            return reader.readNext();
        } catch (CsvMalformedLineException e) {
            log.warn("Malformed CSV near line {}, keeping rows read before it: {}", e.getLineNumber(), e.getMessage());
            return null;
        }
    }

    private String decode(byte[] content) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            String text = decoder.decode(ByteBuffer.wrap(content)).toString();
            if (!text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
                return text.substring(1);
            }
            return text;
        } catch (CharacterCodingException e) {
            throw new LogParseException("File is not valid UTF-8 text", e);
        }
    }

    private Map<String, String> toRow(String[] header, String[] line) {
        Map<String, String> row = new LinkedHashMap<>();
        int width = Math.min(header.length, line.length);
        for (int i = 0; i < width; i++) {
            // duplicate headers: first column wins
            row.putIfAbsent(header[i], line[i]);
        }
        return row;
    }

    private static boolean isBlank(String[] line) {
        for (String cell : line) {
            if (cell != null && !cell.isBlank()) {
                return false;
            }
        }
        return true;
    }

    private static String[] trimAll(String[] cells) {
        String[] trimmed = new String[cells.length];
        for (int i = 0; i < cells.length; i++) {
            trimmed[i] = cells[i] == null ? "" : LogRecordNormalizer.trim(cells[i]);
        }
        return trimmed;
    }
}
