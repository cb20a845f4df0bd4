package ru.tigran.assistantloganalytics.classifier;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Multi-label term counting: every vocabulary term contained in a question
 * (case-sensitive substring) counts once for that question.
 */
@Component
public class TermOccurrenceCounter {

    /**
     * @param records    questions to scan
     * @param vocabulary terms in tie-break order
     * @return terms with at least one hit, most frequent first, ties in vocabulary order
     */
    public List<TermCount> count(List<LogRecord> records, List<String> vocabulary) {
        long[] counts = new long[vocabulary.size()];
        for (LogRecord record : records) {
            for (int i = 0; i < counts.length; i++) {
                if (record.content().contains(vocabulary.get(i))) {
                    counts[i]++;
                }
            }
        }

        // stream sort is stable, so equal counts keep vocabulary order
        return IntStream.range(0, counts.length)
                .filter(i -> counts[i] > 0)
                .mapToObj(i -> new TermCount(vocabulary.get(i), counts[i]))
                .sorted(Comparator.comparingLong(TermCount::count).reversed())
                .toList();
    }

    public record TermCount(String term, long count) {
    }
}
