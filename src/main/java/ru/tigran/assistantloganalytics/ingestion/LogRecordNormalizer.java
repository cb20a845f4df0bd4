package ru.tigran.assistantloganalytics.ingestion;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.List;
import java.util.Map;

/**
 * Converts header-keyed CSV rows into {@link LogRecord}s.
 *
 * Missing columns default to an empty string and every value is trimmed of
 * surrounding whitespace, including no-break spaces and a stray BOM. Rows without content or timestamp are dropped
 * silently; nothing here throws for bad rows.
 */
@Component
public class LogRecordNormalizer {

    public List<LogRecord> normalize(List<Map<String, String>> rows) {
        return rows.stream()
                .map(this::toRecord)
                .filter(record -> !record.content().isEmpty() && !record.timestamp().isEmpty())
                .toList();
    }

    private LogRecord toRecord(Map<String, String> row) {
        return LogRecord.builder()
                .questionId(value(row, LogColumn.QUESTION_ID))
                .content(value(row, LogColumn.CONTENT))
                .timestamp(value(row, LogColumn.TIMESTAMP))
                .source(value(row, LogColumn.SOURCE))
                .userId(value(row, LogColumn.USER_ID))
                .company(value(row, LogColumn.COMPANY))
                .userName(value(row, LogColumn.USER_NAME))
                .nickname(value(row, LogColumn.NICKNAME))
                .email(value(row, LogColumn.EMAIL))
                .feedbackStatus(value(row, LogColumn.FEEDBACK_STATUS))
                .feedbackContent(value(row, LogColumn.FEEDBACK_CONTENT))
                .build();
    }

    private static String value(Map<String, String> row, LogColumn column) {
        String raw = row.get(column.getHeader());
        return raw == null ? "" : trim(raw);
    }

    static String trim(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isTrimmable(value.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmable(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    // String.strip() keeps U+00A0, U+2007, U+202F and U+FEFF
    private static boolean isTrimmable(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }
}
