package ru.tigran.assistantloganalytics.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimestampParts unit тесты")
class TimestampPartsTest {

    @Test
    @DisplayName("datePart - текст до первого пробела или вся строка")
    void datePart() {
        assertEquals("2024-01-01", TimestampParts.datePart("2024-01-01 09:15:00"));
        assertEquals("2024-01-01", TimestampParts.datePart("2024-01-01"));
        assertEquals("", TimestampParts.datePart(" 09:15:00"));
    }

    @Test
    @DisplayName("hourOf - ведущие цифры времени")
    void hourOf() {
        assertEquals(OptionalInt.of(9), TimestampParts.hourOf("2024-01-01 09:15:00"));
        assertEquals(OptionalInt.of(23), TimestampParts.hourOf("2024-01-01 23:59:59"));
        assertEquals(OptionalInt.of(7), TimestampParts.hourOf("2024-01-01 7h"));
    }

    @Test
    @DisplayName("hourOf - пусто при отсутствии времени, нечисловом часе или часе больше 23")
    void hourOfUnreadable() {
        assertTrue(TimestampParts.hourOf("2024-01-01").isEmpty());
        assertTrue(TimestampParts.hourOf("2024-01-01 ab:00").isEmpty());
        assertTrue(TimestampParts.hourOf("2024-01-01 24:00:00").isEmpty());
        assertTrue(TimestampParts.hourOf("2024-01-01 ").isEmpty());
    }
}
