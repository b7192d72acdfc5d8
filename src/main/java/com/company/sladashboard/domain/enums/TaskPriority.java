package com.company.sladashboard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    HIGH("AI"),
    NORMAL("regular");

    private final String taskType;

    TaskPriority(String taskType) {
        this.taskType = taskType;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    /**
     * Task type label shown on the DAG view: high priority tasks are the AI tasks.
     */
    public String getTaskType() {
        return taskType;
    }

    @JsonCreator
    public static TaskPriority fromString(String priority) {
        if (priority == null) {
            return NORMAL;
        }
        try {
            return TaskPriority.valueOf(priority.toUpperCase());
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
