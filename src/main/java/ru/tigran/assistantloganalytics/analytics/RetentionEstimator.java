package ru.tigran.assistantloganalytics.analytics;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Next-day retention estimate.
 *
 * For each pair of adjacent dates present in the data, takes the share of the
 * earlier day's users that show up again on the later day, then averages those
 * shares. This is a pairwise approximation, not a cohort retention curve:
 * "adjacent" means adjacent in the data, so a gap in the calendar still forms a pair.
 * The empty user id is treated as a regular member of a day's user set.
 */
@Component
public class RetentionEstimator {

    /**
     * @return mean next-day retention in percent, 0 when fewer than two dates exist
     */
    public double nextDayRetention(List<LogRecord> records) {
        Map<String, Set<String>> usersByDate = new TreeMap<>();
        for (LogRecord record : records) {
            String date = TimestampParts.datePart(record.timestamp());
            // normalized timestamps are trimmed and non-empty, so this only guards direct callers
            if (date.isEmpty()) {
                continue;
            }
            usersByDate.computeIfAbsent(date, d -> new HashSet<>()).add(record.userId());
        }

        if (usersByDate.size() < 2) {
            return 0;
        }

        List<Set<String>> days = new ArrayList<>(usersByDate.values());
        double retentionSum = 0;
        int comparisons = 0;

        for (int i = 0; i < days.size() - 1; i++) {
            Set<String> today = days.get(i);
            Set<String> tomorrow = days.get(i + 1);
            if (today.isEmpty()) {
                continue;
            }
            long retained = today.stream().filter(tomorrow::contains).count();
            retentionSum += (double) retained / today.size();
            comparisons++;
        }

        return comparisons > 0 ? retentionSum / comparisons * 100 : 0;
    }
}
