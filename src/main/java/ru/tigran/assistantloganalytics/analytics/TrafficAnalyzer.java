package ru.tigran.assistantloganalytics.analytics;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.dto.DailyTrend;
import ru.tigran.assistantloganalytics.dto.HourlyStats;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Time-based views: questions and active users per day, questions per hour of day.
 */
@Component
public class TrafficAnalyzer {

    private static final int HOURS_PER_DAY = 24;

    /**
     * @return one entry per date present, ascending by date string
     */
    public List<DailyTrend> dailyTrend(List<LogRecord> records) {
        Map<String, Long> queries = new TreeMap<>();
        Map<String, Set<String>> users = new TreeMap<>();

        for (LogRecord record : records) {
            String date = TimestampParts.datePart(record.timestamp());
            if (date.isEmpty()) {
                continue;
            }
            queries.merge(date, 1L, Long::sum);
            Set<String> dayUsers = users.computeIfAbsent(date, d -> new HashSet<>());
            if (!record.userId().isEmpty()) {
                dayUsers.add(record.userId());
            }
        }

        List<DailyTrend> trend = new ArrayList<>(queries.size());
        queries.forEach((date, count) -> trend.add(new DailyTrend(date, count, users.get(date).size())));
        return trend;
    }

    /**
     * @return exactly 24 entries for hours 0..23; records with an unreadable hour are not counted
     */
    public List<HourlyStats> hourlyStats(List<LogRecord> records) {
        long[] counts = new long[HOURS_PER_DAY];
        for (LogRecord record : records) {
            OptionalInt hour = TimestampParts.hourOf(record.timestamp());
            if (hour.isPresent()) {
                counts[hour.getAsInt()]++;
            }
        }

        List<HourlyStats> stats = new ArrayList<>(HOURS_PER_DAY);
        for (int hour = 0; hour < HOURS_PER_DAY; hour++) {
            stats.add(new HourlyStats(hour + ":00", counts[hour]));
        }
        return stats;
    }
}
