package com.company.sladashboard.client;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.TaskPriority;
import com.company.sladashboard.dto.request.EntityRequest;
import com.company.sladashboard.dto.request.TaskPriorityRequest;
import com.company.sladashboard.dto.request.TaskRequest;
import com.company.sladashboard.dto.response.DashboardSummaryResponse;
import com.company.sladashboard.exception.MutationRejectedException;
import com.company.sladashboard.invalidation.CacheKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * HTTP client for the dashboard API. Blocking calls run on the I/O executor so the
 * cache's event loop is never blocked.
 */
@Slf4j
public class DashboardApiClient {

    private static final ParameterizedTypeReference<List<DagTask>> TASK_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<SlaEntity>> ENTITY_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<Team>> TEAM_LIST = new ParameterizedTypeReference<>() {
    };
    private static final ParameterizedTypeReference<List<Tenant>> TENANT_LIST = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final Executor ioExecutor;

    public DashboardApiClient(RestClient restClient, Executor ioExecutor) {
        this.restClient = restClient;
        this.ioExecutor = ioExecutor;
    }

    public static DashboardApiClient create(String baseUrl, String bearerToken, Executor ioExecutor) {
        RestClient.Builder builder = RestClient.builder().baseUrl(baseUrl);
        if (bearerToken != null) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + bearerToken);
        }
        return new DashboardApiClient(builder.build(), ioExecutor);
    }

    /**
     * Register a fetcher for every resource type this client can load.
     */
    public void registerFetchers(ClientCacheManager cacheManager) {
        cacheManager.registerFetcher(CacheKeys.TASKS,
                key -> fetchTasks(key.longParam(CacheKeys.PARAM_DAG_ID)));
        cacheManager.registerFetcher(CacheKeys.DASHBOARD_SUMMARY,
                key -> fetchSummary(key.param(CacheKeys.PARAM_TENANT), key.longParam(CacheKeys.PARAM_TEAM_ID)));
        cacheManager.registerFetcher(CacheKeys.TEAM_DASHBOARD,
                key -> fetchSummary(key.param(CacheKeys.PARAM_TENANT), key.longParam(CacheKeys.PARAM_TEAM_ID)));
        cacheManager.registerFetcher(CacheKeys.ENTITIES,
                key -> fetchEntities(key.param(CacheKeys.PARAM_TENANT), key.longParam(CacheKeys.PARAM_TEAM_ID)));
        cacheManager.registerFetcher(CacheKeys.TEAMS,
                key -> fetchTeams(key.param(CacheKeys.PARAM_TENANT)));
        cacheManager.registerFetcher(CacheKeys.TENANTS,
                key -> fetchTenants());
    }

    // ============================================================
    // Reads
    // ============================================================

    public CompletableFuture<List<DagTask>> fetchTasks(long dagId) {
        return read(() -> restClient.get()
                .uri("/api/v1/dags/{dagId}/tasks", dagId)
                .retrieve()
                .body(TASK_LIST));
    }

    public CompletableFuture<DashboardSummaryResponse> fetchSummary(String tenant, Long teamId) {
        return read(() -> restClient.get()
                .uri(uri -> withScope(uri.path("/api/v1/dashboard/summary"), tenant, teamId))
                .retrieve()
                .body(DashboardSummaryResponse.class));
    }

    public CompletableFuture<List<SlaEntity>> fetchEntities(String tenant, Long teamId) {
        return read(() -> restClient.get()
                .uri(uri -> withScope(uri.path("/api/v1/dashboard/entities"), tenant, teamId))
                .retrieve()
                .body(ENTITY_LIST));
    }

    public CompletableFuture<List<Team>> fetchTeams(String tenant) {
        return read(() -> restClient.get()
                .uri(uri -> withScope(uri.path("/api/v1/dashboard/teams"), tenant, null))
                .retrieve()
                .body(TEAM_LIST));
    }

    public CompletableFuture<List<Tenant>> fetchTenants() {
        return read(() -> restClient.get()
                .uri("/api/v1/dashboard/tenants")
                .retrieve()
                .body(TENANT_LIST));
    }

    // ============================================================
    // Writes
    // ============================================================

    public CompletableFuture<SlaEntity> updateEntity(long entityId, EntityRequest request) {
        return write("updateEntity", () -> restClient.put()
                .uri("/api/v1/entities/{entityId}", entityId)
                .body(request)
                .retrieve()
                .body(SlaEntity.class));
    }

    public CompletableFuture<DagTask> createTask(long dagId, TaskRequest request) {
        return write("createTask", () -> restClient.post()
                .uri("/api/v1/dags/{dagId}/tasks", dagId)
                .body(request)
                .retrieve()
                .body(DagTask.class));
    }

    public CompletableFuture<DagTask> updateTask(long taskId, TaskRequest request) {
        return write("updateTask", () -> restClient.put()
                .uri("/api/v1/tasks/{taskId}", taskId)
                .body(request)
                .retrieve()
                .body(DagTask.class));
    }

    public CompletableFuture<Void> deleteTask(long taskId) {
        return write("deleteTask", () -> {
            restClient.delete()
                    .uri("/api/v1/tasks/{taskId}", taskId)
                    .retrieve()
                    .toBodilessEntity();
            return null;
        });
    }

    public CompletableFuture<DagTask> changeTaskPriority(long taskId, TaskPriority priority) {
        return write("changeTaskPriority", () -> restClient.patch()
                .uri("/api/v1/tasks/{taskId}/priority", taskId)
                .body(new TaskPriorityRequest(priority))
                .retrieve()
                .body(DagTask.class));
    }

    // ============================================================
    // Internals
    // ============================================================

    private <T> CompletableFuture<T> read(Supplier<T> call) {
        return CompletableFuture.supplyAsync(call, ioExecutor);
    }

    /**
     * Run a write; any non-2xx answer or transport failure becomes a {@link MutationRejectedException}.
     */
    private <T> CompletableFuture<T> write(String operation, Supplier<T> call) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return call.get();
            } catch (RestClientResponseException e) {
                log.warn("{} rejected with {}: {}", operation, e.getStatusCode().value(), e.getResponseBodyAsString());
                throw new MutationRejectedException(e.getStatusCode().value(),
                        operation + " rejected: " + e.getStatusText(), e);
            } catch (ResourceAccessException e) {
                log.warn("{} failed: {}", operation, e.getMessage());
                throw new MutationRejectedException(0, operation + " failed: " + e.getMessage(), e);
            }
        }, ioExecutor);
    }

    private static URI withScope(UriBuilder uri, String tenant, Long teamId) {
        if (tenant != null) {
            uri.queryParam("tenant", tenant);
        }
        if (teamId != null) {
            uri.queryParam("teamId", teamId);
        }
        return uri.build();
    }
}
