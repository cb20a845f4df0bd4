package ru.tigran.assistantloganalytics.ingestion;

/**
 * Columns of the assistant log export.
 * Maps each localized CSV header to the {@link ru.tigran.assistantloganalytics.model.LogRecord} field it fills.
 */
public enum LogColumn {
    QUESTION_ID("问题ID"),
    CONTENT("问题内容"),
    TIMESTAMP("提问时间"),
    SOURCE("来源"),
    USER_ID("用户ID"),
    COMPANY("公司名"),
    USER_NAME("用户姓名"),
    NICKNAME("用户昵称"),
    EMAIL("邮箱"),
    FEEDBACK_STATUS("反馈状态"),
    FEEDBACK_CONTENT("反馈内容");

    private final String header;

    LogColumn(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
