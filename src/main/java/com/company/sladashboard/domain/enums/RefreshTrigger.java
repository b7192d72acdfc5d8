package com.company.sladashboard.domain.enums;

public enum RefreshTrigger {
    INITIAL,
    SCHEDULED,
    FORCED,
    /** Refresh issued by a committed write; the write's own invalidation event covers it. */
    WRITE;

    public String tag() {
        return name().toLowerCase();
    }
}
