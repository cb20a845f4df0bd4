package ru.tigran.assistantloganalytics.classifier;

/**
 * Audience segments, in display order.
 */
public enum UserSegment {
    INTERNAL("内部员工"),
    EXTERNAL("外部客户"),
    UNKNOWN("未知");

    private final String label;

    UserSegment(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
