package com.company.sladashboard.invalidation;

import java.util.Optional;

/**
 * Named classes of write events. The keys each one invalidates are registered in {@link InvalidationCatalog}.
 */
public enum InvalidationScenario {
    ENTITY_CREATED,
    ENTITY_UPDATED,
    ENTITY_DELETED,
    TEAM_CREATED,
    TEAM_UPDATED,
    TEAM_MEMBER_ADDED,
    TEAM_MEMBER_REMOVED,
    TENANT_CREATED,
    TENANT_UPDATED,
    TASK_CREATED,
    TASK_UPDATED,
    TASK_DELETED,
    TASK_PRIORITY_CHANGED;

    public static Optional<InvalidationScenario> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (InvalidationScenario scenario : values()) {
            if (scenario.name().equalsIgnoreCase(name.trim())) {
                return Optional.of(scenario);
            }
        }
        return Optional.empty();
    }
}
