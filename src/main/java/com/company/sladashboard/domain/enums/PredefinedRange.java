package com.company.sladashboard.domain.enums;

public enum PredefinedRange {
    TODAY("today"),
    YESTERDAY("yesterday"),
    LAST_7_DAYS("last7Days"),
    LAST_30_DAYS("last30Days"),
    THIS_MONTH("thisMonth"),
    CUSTOM("custom");

    private final String label;

    PredefinedRange(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
