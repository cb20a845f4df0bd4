package ru.tigran.assistantloganalytics.analytics;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.classifier.IntentClassifier;
import ru.tigran.assistantloganalytics.classifier.TermOccurrenceCounter;
import ru.tigran.assistantloganalytics.classifier.TermVocabularies;
import ru.tigran.assistantloganalytics.dto.KeywordFrequency;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.List;

/**
 * Question-content views: intents, metals mentioned, business keywords.
 */
@Component
public class ContentAnalyzer {

    private final IntentClassifier intentClassifier;
    private final TermOccurrenceCounter termOccurrenceCounter;

    public ContentAnalyzer(IntentClassifier intentClassifier, TermOccurrenceCounter termOccurrenceCounter) {
        this.intentClassifier = intentClassifier;
        this.termOccurrenceCounter = termOccurrenceCounter;
    }

    /**
     * @return all six intent buckets in fixed order; counts sum to the record count
     */
    public List<NamedValue> classifyIntents(List<LogRecord> records) {
        return intentClassifier.countIntents(records);
    }

    public List<NamedValue> metalDistribution(List<LogRecord> records) {
        return termOccurrenceCounter.count(records, TermVocabularies.METALS).stream()
                .map(term -> new NamedValue(term.term(), term.count()))
                .toList();
    }

    public List<KeywordFrequency> topKeywords(List<LogRecord> records) {
        return termOccurrenceCounter.count(records, TermVocabularies.KEYWORDS).stream()
                .map(term -> new KeywordFrequency(term.term(), term.count()))
                .toList();
    }
}
