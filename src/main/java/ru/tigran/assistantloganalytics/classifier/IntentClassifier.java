package ru.tigran.assistantloganalytics.classifier;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Single-label intent classification: first matching category wins.
 */
@Component
public class IntentClassifier {

    public IntentCategory classify(String content) {
        for (IntentCategory category : IntentCategory.values()) {
            if (category.matches(content)) {
                return category;
            }
        }
        return IntentCategory.OTHER;
    }

    /**
     * Counts records per intent.
     *
     * @return one entry per category in declaration order, zero counts included
     */
    public List<NamedValue> countIntents(List<LogRecord> records) {
        Map<IntentCategory, Long> counts = new EnumMap<>(IntentCategory.class);
        for (LogRecord record : records) {
            counts.merge(classify(record.content()), 1L, Long::sum);
        }
        return Arrays.stream(IntentCategory.values())
                .map(category -> new NamedValue(category.getLabel(), counts.getOrDefault(category, 0L)))
                .toList();
    }
}
