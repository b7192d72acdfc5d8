package com.company.sladashboard.client;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.enums.TaskPriority;
import com.company.sladashboard.dto.request.TaskRequest;
import com.company.sladashboard.invalidation.CacheKeys;
import com.company.sladashboard.invalidation.InvalidationParams;
import com.company.sladashboard.invalidation.InvalidationScenario;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * Optimistic task mutations for the DAG view. The cached task list is kept in display
 * order: high priority tasks first, otherwise as returned by the server.
 */
@RequiredArgsConstructor
public class TaskMutations {

    private static final Comparator<DagTask> HIGH_PRIORITY_FIRST =
            Comparator.comparing(task -> task.isHighPriority() ? 0 : 1);

    private final ClientCacheManager cacheManager;
    private final DashboardApiClient apiClient;

    public static QueryKey tasksKey(long dagId) {
        return QueryKey.parse(CacheKeys.tasksByDag(dagId));
    }

    /**
     * The team dashboard entry as {@link DashboardApiClient} loads it, scoped to a tenant.
     */
    public static QueryKey teamDashboardKey(String tenantName, long teamId) {
        return QueryKey.parse(CacheKeys.teamDashboard(tenantName, teamId));
    }

    /**
     * Change a task's priority. The task moves to its new place in the list and its type
     * label follows the priority. On failure the list and the team dashboard are restored.
     *
     * @param teamDashboardKey the owning team's dashboard entry, or null when not cached
     */
    public CompletableFuture<DagTask> changePriority(long dagId, long taskId, Long teamId,
                                                     TaskPriority newPriority, QueryKey teamDashboardKey) {
        TaskPriority oldPriority = cacheManager.<List<DagTask>>peek(tasksKey(dagId))
                .flatMap(tasks -> tasks.stream().filter(t -> t.getId() != null && t.getId() == taskId).findFirst())
                .map(DagTask::getPriority)
                .orElse(null);

        List<QueryKey> rollbackKeys = new ArrayList<>();
        if (teamDashboardKey != null) {
            rollbackKeys.add(teamDashboardKey);
        }

        return cacheManager.mutate(OptimisticMutation.<List<DagTask>, DagTask>builder()
                .queryKey(tasksKey(dagId))
                .localUpdater(tasks -> reprioritise(tasks, taskId, newPriority))
                .remoteCall(() -> apiClient.changeTaskPriority(taskId, newPriority))
                .invalidationScenario(InvalidationScenario.TASK_PRIORITY_CHANGED)
                .invalidationParams(InvalidationParams.builder()
                        .dagId(dagId)
                        .taskId(taskId)
                        .teamId(teamId)
                        .oldPriority(oldPriority)
                        .newPriority(newPriority)
                        .build())
                .rollbackKeys(rollbackKeys)
                .build());
    }

    public CompletableFuture<DagTask> createTask(long dagId, TaskRequest request) {
        TaskPriority priority = request.getPriority() != null ? request.getPriority() : TaskPriority.NORMAL;
        DagTask provisional = DagTask.builder()
                .dagId(dagId)
                .name(request.getName())
                .description(request.getDescription())
                .priority(priority)
                .taskType(priority.getTaskType())
                .status(request.getStatus())
                .build();

        return cacheManager.mutate(OptimisticMutation.<List<DagTask>, DagTask>builder()
                .queryKey(tasksKey(dagId))
                .localUpdater(tasks -> {
                    List<DagTask> updated = copyOf(tasks);
                    updated.add(provisional);
                    updated.sort(HIGH_PRIORITY_FIRST);
                    return updated;
                })
                .remoteCall(() -> apiClient.createTask(dagId, request))
                .invalidationScenario(InvalidationScenario.TASK_CREATED)
                .invalidationParams(InvalidationParams.builder().dagId(dagId).build())
                .build());
    }

    public CompletableFuture<DagTask> updateTask(long dagId, long taskId, TaskRequest request) {
        return cacheManager.mutate(OptimisticMutation.<List<DagTask>, DagTask>builder()
                .queryKey(tasksKey(dagId))
                .localUpdater(tasks -> copyOf(tasks).stream()
                        .map(task -> task.getId() != null && task.getId() == taskId ? patch(task, request) : task)
                        .sorted(HIGH_PRIORITY_FIRST)
                        .collect(Collectors.toList()))
                .remoteCall(() -> apiClient.updateTask(taskId, request))
                .invalidationScenario(InvalidationScenario.TASK_UPDATED)
                .invalidationParams(InvalidationParams.builder().dagId(dagId).taskId(taskId).build())
                .build());
    }

    public CompletableFuture<Void> deleteTask(long dagId, long taskId) {
        return cacheManager.mutate(OptimisticMutation.<List<DagTask>, Void>builder()
                .queryKey(tasksKey(dagId))
                .localUpdater(tasks -> copyOf(tasks).stream()
                        .filter(task -> task.getId() == null || task.getId() != taskId)
                        .collect(Collectors.toList()))
                .remoteCall(() -> apiClient.deleteTask(taskId))
                .invalidationScenario(InvalidationScenario.TASK_DELETED)
                .invalidationParams(InvalidationParams.builder().dagId(dagId).taskId(taskId).build())
                .build());
    }

    static List<DagTask> reprioritise(List<DagTask> tasks, long taskId, TaskPriority priority) {
        List<DagTask> updated = copyOf(tasks).stream()
                .map(task -> task.getId() != null && task.getId() == taskId
                        ? task.toBuilder().priority(priority).taskType(priority.getTaskType()).build()
                        : task)
                .collect(Collectors.toCollection(ArrayList::new));
        updated.sort(HIGH_PRIORITY_FIRST);
        return updated;
    }

    private static DagTask patch(DagTask task, TaskRequest request) {
        DagTask.DagTaskBuilder builder = task.toBuilder();
        if (request.getName() != null) {
            builder.name(request.getName());
        }
        if (request.getDescription() != null) {
            builder.description(request.getDescription());
        }
        if (request.getStatus() != null) {
            builder.status(request.getStatus());
        }
        if (request.getPriority() != null) {
            builder.priority(request.getPriority()).taskType(request.getPriority().getTaskType());
        }
        return builder.build();
    }

    private static List<DagTask> copyOf(List<DagTask> tasks) {
        return tasks != null ? new ArrayList<>(tasks) : new ArrayList<>();
    }
}
