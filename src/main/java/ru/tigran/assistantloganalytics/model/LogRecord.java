package ru.tigran.assistantloganalytics.model;

import lombok.Builder;

/**
 * One normalized assistant interaction, created once per valid CSV row.
 *
 * Every field is non-null: absent values are stored as empty strings.
 * {@code content} and {@code timestamp} are never empty inside a snapshot
 * because the normalizer drops such rows.
 *
 * @param questionId      question identifier from the export
 * @param content         the question text
 * @param timestamp       time the question was asked, {@code YYYY-MM-DD HH:MM:SS}
 * @param source          platform/channel label, may be empty
 * @param userId          user identifier, empty means unattributed
 * @param company         company name of the asking user
 * @param userName        real name of the asking user
 * @param nickname        display name of the asking user
 * @param email           e-mail of the asking user
 * @param feedbackStatus  like/dislike marker left on the answer
 * @param feedbackContent free-text feedback left on the answer
 */
@Builder
public record LogRecord(
        String questionId,
        String content,
        String timestamp,
        String source,
        String userId,
        String company,
        String userName,
        String nickname,
        String email,
        String feedbackStatus,
        String feedbackContent
) {
    public LogRecord {
        questionId = orEmpty(questionId);
        content = orEmpty(content);
        timestamp = orEmpty(timestamp);
        source = orEmpty(source);
        userId = orEmpty(userId);
        company = orEmpty(company);
        userName = orEmpty(userName);
        nickname = orEmpty(nickname);
        email = orEmpty(email);
        feedbackStatus = orEmpty(feedbackStatus);
        feedbackContent = orEmpty(feedbackContent);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
