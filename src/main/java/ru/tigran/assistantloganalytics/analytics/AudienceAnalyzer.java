package ru.tigran.assistantloganalytics.analytics;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.classifier.InternalUserRule;
import ru.tigran.assistantloganalytics.classifier.UserSegment;
import ru.tigran.assistantloganalytics.dto.NamedValue;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Who asks: channels, companies, internal vs external users.
 */
@Component
public class AudienceAnalyzer {

    static final String UNKNOWN_SOURCE = "Unknown";
    static final int TOP_COMPANIES_LIMIT = 10;

    private final InternalUserRule internalUserRule;

    public AudienceAnalyzer(InternalUserRule internalUserRule) {
        this.internalUserRule = internalUserRule;
    }

    /**
     * @return question count per source in first-seen order; empty source is reported as "Unknown"
     */
    public List<NamedValue> sourceDistribution(List<LogRecord> records) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (LogRecord record : records) {
            String source = record.source().isEmpty() ? UNKNOWN_SOURCE : record.source();
            counts.merge(source, 1L, Long::sum);
        }
        return toNamedValues(counts);
    }

    /**
     * Internal questions are pooled under {@link InternalUserRule#INTERNAL_COMPANY_LABEL};
     * external questions without a company are left out.
     *
     * @return up to ten companies, most active first, ties in first-seen order
     */
    public List<NamedValue> topCompanies(List<LogRecord> records) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (LogRecord record : records) {
            if (internalUserRule.isInternal(record)) {
                counts.merge(InternalUserRule.INTERNAL_COMPANY_LABEL, 1L, Long::sum);
                continue;
            }
            String company = record.company().strip();
            if (!company.isEmpty()) {
                counts.merge(company, 1L, Long::sum);
            }
        }

        return toNamedValues(counts).stream()
                .sorted(Comparator.comparingLong(NamedValue::value).reversed())
                .limit(TOP_COMPANIES_LIMIT)
                .toList();
    }

    /**
     * @return non-empty segments in internal, external, unknown order; values sum to the record count
     */
    public List<NamedValue> userTypeDistribution(List<LogRecord> records) {
        Map<UserSegment, Long> counts = new EnumMap<>(UserSegment.class);
        for (LogRecord record : records) {
            counts.merge(internalUserRule.segmentOf(record), 1L, Long::sum);
        }
        return Arrays.stream(UserSegment.values())
                .filter(counts::containsKey)
                .map(segment -> new NamedValue(segment.getLabel(), counts.get(segment)))
                .toList();
    }

    private static List<NamedValue> toNamedValues(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .map(entry -> new NamedValue(entry.getKey(), entry.getValue()))
                .toList();
    }
}
