package com.company.sladashboard.invalidation;

/**
 * The entity store's complete write surface, each write bound to the scenario it raises.
 */
public enum StoreMutation {
    CREATE_ENTITY(InvalidationScenario.ENTITY_CREATED, true),
    UPDATE_ENTITY(InvalidationScenario.ENTITY_UPDATED, true),
    DELETE_ENTITY(InvalidationScenario.ENTITY_DELETED, true),
    CREATE_TEAM(InvalidationScenario.TEAM_CREATED, true),
    UPDATE_TEAM(InvalidationScenario.TEAM_UPDATED, true),
    ADD_TEAM_MEMBER(InvalidationScenario.TEAM_MEMBER_ADDED, false),
    REMOVE_TEAM_MEMBER(InvalidationScenario.TEAM_MEMBER_REMOVED, false),
    CREATE_TENANT(InvalidationScenario.TENANT_CREATED, true),
    UPDATE_TENANT(InvalidationScenario.TENANT_UPDATED, true),
    CREATE_TASK(InvalidationScenario.TASK_CREATED, false),
    UPDATE_TASK(InvalidationScenario.TASK_UPDATED, false),
    DELETE_TASK(InvalidationScenario.TASK_DELETED, false),
    CHANGE_TASK_PRIORITY(InvalidationScenario.TASK_PRIORITY_CHANGED, false);

    private final InvalidationScenario scenario;
    private final boolean touchesSnapshot;

    StoreMutation(InvalidationScenario scenario, boolean touchesSnapshot) {
        this.scenario = scenario;
        this.touchesSnapshot = touchesSnapshot;
    }

    public InvalidationScenario getScenario() {
        return scenario;
    }

    /**
     * Whether the write changes data held in the server snapshot (entities, teams, tenants).
     */
    public boolean touchesSnapshot() {
        return touchesSnapshot;
    }
}
