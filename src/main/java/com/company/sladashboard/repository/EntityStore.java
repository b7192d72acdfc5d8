package com.company.sladashboard.repository;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.TaskPriority;

import java.util.List;
import java.util.Optional;

/**
 * Authoritative store of dashboard data.
 * <p>
 * Reads that cannot reach the store throw {@link com.company.sladashboard.exception.StoreUnavailableException};
 * writes the store refuses throw {@link com.company.sladashboard.exception.MutationRejectedException}.
 */
public interface EntityStore {

    List<SlaEntity> listEntities();

    List<Team> listTeams();

    List<Tenant> listTenants();

    Optional<SlaEntity> findEntity(long entityId);

    Optional<Team> findTeam(long teamId);

    Optional<Tenant> findTenant(long tenantId);

    List<String> listTeamMembers(String teamName);

    List<DagTask> listTasks(long dagId);

    Optional<DagTask> findTask(long taskId);

    // Write surface, one method per StoreMutation

    SlaEntity createEntity(SlaEntity entity);

    SlaEntity updateEntity(long entityId, SlaEntity entity);

    void deleteEntity(long entityId);

    Team createTeam(Team team);

    Team updateTeam(long teamId, Team team);

    void addTeamMember(String teamName, String memberId);

    void removeTeamMember(String teamName, String memberId);

    Tenant createTenant(Tenant tenant);

    Tenant updateTenant(long tenantId, Tenant tenant);

    DagTask createTask(DagTask task);

    DagTask updateTask(long taskId, DagTask task);

    void deleteTask(long taskId);

    DagTask updateTaskPriority(long taskId, TaskPriority priority);
}
