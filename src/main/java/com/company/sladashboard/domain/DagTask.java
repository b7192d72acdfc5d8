package com.company.sladashboard.domain;

import com.company.sladashboard.domain.enums.TaskPriority;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A task within a DAG entity. Not part of the dashboard snapshot; read straight from the store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class DagTask {
    Long id;
    Long dagId;
    String name;
    String description;
    TaskPriority priority;
    String taskType;
    String status;
    Instant updatedAt;

    public boolean isHighPriority() {
        return priority == TaskPriority.HIGH;
    }
}
