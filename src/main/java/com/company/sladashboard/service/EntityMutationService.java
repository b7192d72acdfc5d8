package com.company.sladashboard.service;

import com.company.sladashboard.cache.DataCache;
import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.EntityType;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import com.company.sladashboard.domain.enums.TaskPriority;
import com.company.sladashboard.dto.request.*;
import com.company.sladashboard.event.StoreMutationCommittedEvent;
import com.company.sladashboard.exception.CacheNotReadyException;
import com.company.sladashboard.exception.EntityNotFoundException;
import com.company.sladashboard.exception.MutationRejectedException;
import com.company.sladashboard.exception.StoreUnavailableException;
import com.company.sladashboard.invalidation.InvalidationCatalog;
import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.StoreMutation;
import com.company.sladashboard.repository.EntityStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Write path: store write, cache refresh when the snapshot is affected, then the
 * committed event that drives the invalidation bus.
 * <p>
 * Results returned to callers are re-read from the store. A refresh failure after a
 * committed write does not fail the write; clients still get the bus event and TTL
 * refetches cover the rest.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EntityMutationService {

    private final EntityStore entityStore;
    private final DataCache dataCache;
    private final InvalidationCatalog invalidationCatalog;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    // ============================================================
    // Entities
    // ============================================================

    public SlaEntity createEntity(EntityRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new MutationRejectedException("Entity name is required");
        }
        if (request.getTeamId() == null || request.getTenantName() == null) {
            throw new MutationRejectedException("Entity team and tenant are required");
        }

        SlaEntity created = entityStore.createEntity(toEntity(request));
        SlaEntity stored = reReadEntity(created.getId());

        commit(StoreMutation.CREATE_ENTITY, entityParams(stored));
        return stored;
    }

    public SlaEntity updateEntity(long entityId, EntityRequest request) {
        SlaEntity before = reReadEntity(entityId);
        entityStore.updateEntity(entityId, toEntity(request));
        SlaEntity stored = reReadEntity(entityId);

        commit(StoreMutation.UPDATE_ENTITY, entityParams(stored));

        // A move between teams or tenants also changes the views the entity left
        if (!Objects.equals(before.getTeamId(), stored.getTeamId())
                || !Objects.equals(before.getTenantName(), stored.getTenantName())) {
            publish(StoreMutation.UPDATE_ENTITY, entityParams(before));
        }
        return stored;
    }

    public void deleteEntity(long entityId) {
        SlaEntity existing = reReadEntity(entityId);
        entityStore.deleteEntity(entityId);
        commit(StoreMutation.DELETE_ENTITY, entityParams(existing));
    }

    // ============================================================
    // Teams and tenants
    // ============================================================

    public Team createTeam(TeamRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new MutationRejectedException("Team name is required");
        }

        Team created = entityStore.createTeam(Team.builder()
                .name(request.getName())
                .description(request.getDescription())
                .build());
        Team stored = reReadTeam(created.getId());

        commit(StoreMutation.CREATE_TEAM, InvalidationParams.builder()
                .teamId(stored.getId())
                .teamName(stored.getName())
                .build());
        return stored;
    }

    public Team updateTeam(long teamId, TeamRequest request) {
        Team before = reReadTeam(teamId);
        entityStore.updateTeam(teamId, Team.builder()
                .name(request.getName())
                .description(request.getDescription())
                .build());
        Team stored = reReadTeam(teamId);

        commit(StoreMutation.UPDATE_TEAM, InvalidationParams.builder()
                .teamId(stored.getId())
                .teamName(stored.getName())
                .build());

        if (!before.getName().equals(stored.getName())) {
            publish(StoreMutation.UPDATE_TEAM, InvalidationParams.builder()
                    .teamId(before.getId())
                    .teamName(before.getName())
                    .build());
        }
        return stored;
    }

    public List<String> listTeamMembers(String teamName) {
        return entityStore.listTeamMembers(teamName);
    }

    public List<String> addTeamMember(String teamName, String memberId) {
        entityStore.addTeamMember(teamName, memberId);
        commit(StoreMutation.ADD_TEAM_MEMBER, InvalidationParams.builder().teamName(teamName).build());
        return entityStore.listTeamMembers(teamName);
    }

    public List<String> removeTeamMember(String teamName, String memberId) {
        entityStore.removeTeamMember(teamName, memberId);
        commit(StoreMutation.REMOVE_TEAM_MEMBER, InvalidationParams.builder().teamName(teamName).build());
        return entityStore.listTeamMembers(teamName);
    }

    public Tenant createTenant(TenantRequest request) {
        if (request.getName() == null || request.getName().isBlank()) {
            throw new MutationRejectedException("Tenant name is required");
        }

        Tenant created = entityStore.createTenant(Tenant.builder()
                .name(request.getName())
                .description(request.getDescription())
                .active(request.getActive())
                .build());
        Tenant stored = reReadTenant(created.getId());

        commit(StoreMutation.CREATE_TENANT, InvalidationParams.builder().tenantName(stored.getName()).build());
        return stored;
    }

    public Tenant updateTenant(long tenantId, TenantRequest request) {
        entityStore.updateTenant(tenantId, Tenant.builder()
                .name(request.getName())
                .description(request.getDescription())
                .active(request.getActive())
                .build());
        Tenant stored = reReadTenant(tenantId);

        commit(StoreMutation.UPDATE_TENANT, InvalidationParams.builder().tenantName(stored.getName()).build());
        return stored;
    }

    // ============================================================
    // DAG tasks
    // ============================================================

    public List<DagTask> listTasks(long dagId) {
        requireDag(dagId);
        return entityStore.listTasks(dagId);
    }

    public DagTask createTask(long dagId, TaskRequest request) {
        requireDag(dagId);
        if (request.getName() == null || request.getName().isBlank()) {
            throw new MutationRejectedException("Task name is required");
        }

        DagTask created = entityStore.createTask(DagTask.builder()
                .dagId(dagId)
                .name(request.getName())
                .description(request.getDescription())
                .priority(request.getPriority())
                .status(request.getStatus())
                .build());
        DagTask stored = reReadTask(created.getId());

        commit(StoreMutation.CREATE_TASK, InvalidationParams.builder()
                .dagId(dagId)
                .taskId(stored.getId())
                .build());
        return stored;
    }

    public DagTask updateTask(long taskId, TaskRequest request) {
        DagTask before = reReadTask(taskId);
        entityStore.updateTask(taskId, DagTask.builder()
                .name(request.getName())
                .description(request.getDescription())
                .status(request.getStatus())
                .build());
        DagTask stored = reReadTask(taskId);

        if (request.getPriority() != null && request.getPriority() != stored.getPriority()) {
            return changeTaskPriority(taskId, request.getPriority());
        }

        commit(StoreMutation.UPDATE_TASK, InvalidationParams.builder()
                .dagId(before.getDagId())
                .taskId(taskId)
                .build());
        return stored;
    }

    public void deleteTask(long taskId) {
        DagTask existing = reReadTask(taskId);
        entityStore.deleteTask(taskId);
        commit(StoreMutation.DELETE_TASK, InvalidationParams.builder()
                .dagId(existing.getDagId())
                .taskId(taskId)
                .build());
    }

    public DagTask changeTaskPriority(long taskId, TaskPriority newPriority) {
        DagTask before = reReadTask(taskId);
        entityStore.updateTaskPriority(taskId, newPriority);
        DagTask stored = reReadTask(taskId);

        Long teamId = entityStore.findEntity(before.getDagId())
                .map(SlaEntity::getTeamId)
                .orElse(null);

        commit(StoreMutation.CHANGE_TASK_PRIORITY, InvalidationParams.builder()
                .dagId(before.getDagId())
                .taskId(taskId)
                .teamId(teamId)
                .oldPriority(before.getPriority())
                .newPriority(stored.getPriority())
                .build());
        return stored;
    }

    // ============================================================
    // Commit
    // ============================================================

    private void commit(StoreMutation mutation, InvalidationParams params) {
        if (mutation.touchesSnapshot()) {
            try {
                dataCache.forceRefresh(RefreshTrigger.WRITE);
            } catch (StoreUnavailableException | CacheNotReadyException e) {
                log.warn("Cache refresh after {} failed, serving previous snapshot: {}",
                        mutation, e.getMessage());
                meterRegistry.counter("sla.mutation.refresh.failures", "mutation", mutation.name()).increment();
            }
        }
        publish(mutation, params);
    }

    private void publish(StoreMutation mutation, InvalidationParams params) {
        List<String> affectedKeys = invalidationCatalog.resolve(mutation.getScenario(), params);

        log.info("Committed {} ({} keys invalidated)", mutation, affectedKeys.size());
        meterRegistry.counter("sla.mutations", "mutation", mutation.name()).increment();

        eventPublisher.publishEvent(new StoreMutationCommittedEvent(mutation, params, affectedKeys));
    }

    private static InvalidationParams entityParams(SlaEntity entity) {
        return InvalidationParams.builder()
                .entityId(entity.getId())
                .teamId(entity.getTeamId())
                .tenantName(entity.getTenantName())
                .build();
    }

    private SlaEntity reReadEntity(long entityId) {
        return entityStore.findEntity(entityId)
                .orElseThrow(() -> new EntityNotFoundException("Entity", entityId));
    }

    private Team reReadTeam(long teamId) {
        return entityStore.findTeam(teamId)
                .orElseThrow(() -> new EntityNotFoundException("Team", teamId));
    }

    private Tenant reReadTenant(long tenantId) {
        return entityStore.findTenant(tenantId)
                .orElseThrow(() -> new EntityNotFoundException("Tenant", tenantId));
    }

    private DagTask reReadTask(long taskId) {
        return entityStore.findTask(taskId)
                .orElseThrow(() -> new EntityNotFoundException("Task", taskId));
    }

    private void requireDag(long dagId) {
        SlaEntity dag = reReadEntity(dagId);
        if (dag.getType() != EntityType.DAG) {
            throw new MutationRejectedException("Entity " + dagId + " is not a DAG");
        }
    }

    private static SlaEntity toEntity(EntityRequest request) {
        return SlaEntity.builder()
                .name(request.getName())
                .type(request.getType())
                .tenantName(request.getTenantName())
                .teamId(request.getTeamId())
                .description(request.getDescription())
                .slaTarget(request.getSlaTarget())
                .currentSla(request.getCurrentSla())
                .status(request.getStatus())
                .refreshFrequency(request.getRefreshFrequency())
                .lastRefreshed(request.getLastRefreshed())
                .owner(request.getOwner())
                .ownerEmail(request.getOwnerEmail())
                .build();
    }
}
