package ru.tigran.assistantloganalytics.classifier;

import org.springframework.stereotype.Component;
import ru.tigran.assistantloganalytics.model.LogRecord;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether a question was asked by an employee of the operating company,
 * based on identity fields only.
 */
@Component
public class InternalUserRule {

    /**
     * Bucket label used for all internal questions in the company ranking.
     */
    public static final String INTERNAL_COMPANY_LABEL = "上海有色网 (SMM)";

    private static final List<String> ORGANIZATION_MARKERS = List.of("smm", "上海有色网");

    public boolean isInternal(LogRecord record) {
        String identity = String.join(" ",
                record.company(),
                record.userName(),
                record.nickname(),
                record.email()
        ).toLowerCase(Locale.ROOT);

        return ORGANIZATION_MARKERS.stream().anyMatch(identity::contains);
    }

    /**
     * Internal if the rule matches, external if a company is given, unknown otherwise.
     */
    public UserSegment segmentOf(LogRecord record) {
        if (isInternal(record)) {
            return UserSegment.INTERNAL;
        }
        if (!record.company().isBlank()) {
            return UserSegment.EXTERNAL;
        }
        return UserSegment.UNKNOWN;
    }
}
