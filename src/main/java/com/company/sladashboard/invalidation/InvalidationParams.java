package com.company.sladashboard.invalidation;

import com.company.sladashboard.domain.enums.TaskPriority;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters of a write event. Every field is optional; a rule whose parameter
 * is missing falls back to the broader key of the same family.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvalidationParams {

    private static final InvalidationParams NONE = InvalidationParams.builder().build();

    Long entityId;
    Long teamId;
    String teamName;
    String tenantName;
    Long dagId;
    Long taskId;
    TaskPriority oldPriority;
    TaskPriority newPriority;

    public static InvalidationParams none() {
        return NONE;
    }

    /**
     * Event context carried on the bus: the non-null parameters by name.
     */
    public Map<String, Object> toContext() {
        Map<String, Object> context = new LinkedHashMap<>();
        putIfPresent(context, "entityId", entityId);
        putIfPresent(context, "teamId", teamId);
        putIfPresent(context, "teamName", teamName);
        putIfPresent(context, "tenantName", tenantName);
        putIfPresent(context, "dagId", dagId);
        putIfPresent(context, "taskId", taskId);
        putIfPresent(context, "oldPriority", oldPriority);
        putIfPresent(context, "newPriority", newPriority);
        return context;
    }

    private static void putIfPresent(Map<String, Object> context, String name, Object value) {
        if (value != null) {
            context.put(name, value);
        }
    }
}
