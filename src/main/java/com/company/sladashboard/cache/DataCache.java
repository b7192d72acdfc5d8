package com.company.sladashboard.cache;

import com.company.sladashboard.config.SlaDashboardProperties;
import com.company.sladashboard.domain.*;
import com.company.sladashboard.domain.enums.CacheState;
import com.company.sladashboard.domain.enums.EntityType;
import com.company.sladashboard.domain.enums.RefreshTrigger;
import com.company.sladashboard.dto.request.IncrementalUpdateRequest;
import com.company.sladashboard.event.CacheRefreshedEvent;
import com.company.sladashboard.event.EntityChangedEvent;
import com.company.sladashboard.exception.CacheNotReadyException;
import com.company.sladashboard.exception.StoreUnavailableException;
import com.company.sladashboard.repository.EntityStore;
import com.company.sladashboard.service.MetricsAggregator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.*;
import java.util.*;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * In-memory snapshot of the full dashboard dataset.
 * <p>
 * Reads are lock-free against the installed {@link CacheSnapshot}. Refreshes and incremental
 * updates are serialised by a single lock and install a new snapshot with a higher version,
 * so a reader sees either the old or the new dataset and never a mix. A failed refresh keeps
 * the previous snapshot. Reads before the first successful load throw {@link CacheNotReadyException}.
 */
@Service
@Slf4j
public class DataCache implements SmartLifecycle {

    private final EntityStore entityStore;
    private final MetricsAggregator aggregator;
    private final TaskScheduler taskScheduler;
    private final SlaDashboardProperties.Cache settings;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Tracer tracer;
    private final Clock clock;

    private final AtomicReference<CacheSnapshot> snapshot = new AtomicReference<>();
    private final AtomicReference<CacheState> state = new AtomicReference<>(CacheState.UNINITIALIZED);
    private final AtomicLong versionSequence = new AtomicLong();
    private final ReentrantLock refreshLock = new ReentrantLock();
    private final Counter refreshFailures;

    private final Object scheduleMonitor = new Object();
    private ScheduledFuture<?> nextRefresh;

    public DataCache(EntityStore entityStore,
                     MetricsAggregator aggregator,
                     @Qualifier("taskScheduler") TaskScheduler taskScheduler,
                     SlaDashboardProperties properties,
                     ApplicationEventPublisher eventPublisher,
                     MeterRegistry meterRegistry,
                     Tracer tracer,
                     Clock clock) {
        this.entityStore = entityStore;
        this.aggregator = aggregator;
        this.taskScheduler = taskScheduler;
        this.settings = properties.getCache();
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
        this.tracer = tracer;
        this.clock = clock;
        this.refreshFailures = Counter.builder("sla.cache.refresh.failures")
                .description("Snapshot refreshes that failed and kept the previous snapshot")
                .register(meterRegistry);
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    /**
     * Load the first snapshot and schedule periodic refreshes. A failed first load
     * is retried after the initial retry delay; reads stay unavailable until then.
     */
    @Override
    public void start() {
        if (!state.compareAndSet(CacheState.UNINITIALIZED, CacheState.LOADING)) {
            log.warn("Ignoring cache start in state {}", state.get());
            return;
        }

        log.info("Loading dashboard cache (refresh interval {})", settings.getRefreshInterval());

        try {
            refresh(RefreshTrigger.INITIAL);
        } catch (StoreUnavailableException e) {
            log.warn("Initial cache load failed, retrying in {}", settings.getInitialRetryDelay());
        }

        scheduleNext(nextDelay());
    }

    @Override
    public void stop() {
        CacheState previous = state.getAndSet(CacheState.STOPPED);
        synchronized (scheduleMonitor) {
            if (nextRefresh != null) {
                nextRefresh.cancel(false);
                nextRefresh = null;
            }
        }
        snapshot.set(null);
        log.info("Dashboard cache stopped (was {})", previous);
    }

    @Override
    public boolean isRunning() {
        CacheState current = state.get();
        return current != CacheState.UNINITIALIZED && current != CacheState.STOPPED;
    }

    /**
     * Start ahead of the web server so the first load happens before requests arrive.
     */
    @Override
    public int getPhase() {
        return 0;
    }

    // ============================================================
    // Refresh
    // ============================================================

    /**
     * Refresh now and restart the periodic schedule from this point.
     *
     * @throws StoreUnavailableException when the refresh failed; the previous snapshot is kept
     */
    public CacheStatus forceRefresh() {
        return forceRefresh(RefreshTrigger.FORCED);
    }

    /**
     * As {@link #forceRefresh()}, recording {@code trigger} on the refresh timer and the published event.
     */
    public CacheStatus forceRefresh(RefreshTrigger trigger) {
        CacheState current = state.get();
        if (current == CacheState.UNINITIALIZED || current == CacheState.STOPPED) {
            throw new CacheNotReadyException(current);
        }

        refresh(trigger);
        scheduleNext(settings.getRefreshInterval());
        return getCacheStatus();
    }

    void runScheduledRefresh() {
        RefreshTrigger trigger = snapshot.get() == null ? RefreshTrigger.INITIAL : RefreshTrigger.SCHEDULED;
        try {
            refresh(trigger);
        } catch (StoreUnavailableException e) {
            log.warn("Scheduled cache refresh failed, next attempt in {}", nextDelay());
        } finally {
            scheduleNext(nextDelay());
        }
    }

    private CacheSnapshot refresh(RefreshTrigger trigger) {
        refreshLock.lock();
        Timer.Sample sample = Timer.start(meterRegistry);
        Span span = tracer.spanBuilder("sla-cache.refresh")
                .setAttribute("trigger", trigger.tag())
                .startSpan();
        String outcome = "success";

        try (Scope ignored = span.makeCurrent()) {
            CacheSnapshot current = snapshot.get();
            if (current != null) {
                state.compareAndSet(CacheState.READY, CacheState.REFRESHING);
            }

            long version = versionSequence.incrementAndGet();
            log.info("Refreshing dashboard cache (trigger={}, version={})", trigger.tag(), version);

            List<SlaEntity> entities = entityStore.listEntities();
            List<Team> teams = entityStore.listTeams();
            List<Tenant> tenants = entityStore.listTenants();

            Instant now = clock.instant();
            CacheSnapshot next = CacheSnapshot.build(
                    version, entities, teams, tenants, retainedChanges(current, now), now, aggregator);
            install(next);

            span.setAttribute("entities", entities.size());
            log.info("Dashboard cache refreshed: version={}, entities={}, teams={}, tenants={}",
                    version, entities.size(), teams.size(), tenants.size());

            eventPublisher.publishEvent(new CacheRefreshedEvent(getCacheStatus(), trigger));
            return next;

        } catch (RuntimeException e) {
            outcome = "failure";
            refreshFailures.increment();
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            state.compareAndSet(CacheState.REFRESHING, CacheState.READY);

            log.error("Dashboard cache refresh failed (trigger={}), keeping snapshot version {}",
                    trigger.tag(), currentVersion(), e);

            if (e instanceof StoreUnavailableException) {
                throw e;
            }
            throw new StoreUnavailableException("cache refresh", e);

        } finally {
            span.end();
            sample.stop(meterRegistry.timer("sla.cache.refresh",
                    "trigger", trigger.tag(),
                    "outcome", outcome));
            refreshLock.unlock();
        }
    }

    /**
     * Apply one entity change from the poller by installing a new snapshot with the entity replaced.
     * Returns empty when the team or entity is not in the current snapshot.
     */
    public Optional<EntityChange> applyIncrementalUpdate(IncrementalUpdateRequest update) {
        refreshLock.lock();
        try {
            CacheSnapshot current = requireSnapshot();

            Optional<Team> team = current.findTeamByName(update.getTeamName());
            if (team.isEmpty()) {
                log.debug("Incremental update for unknown team {}", update.getTeamName());
                return Optional.empty();
            }

            Long teamId = team.get().getId();
            EntityType type = EntityType.fromString(update.getEntityType());
            Optional<SlaEntity> existing = current.getEntities().stream()
                    .filter(e -> Objects.equals(e.getName(), update.getEntityName())
                            && e.getType() == type
                            && Objects.equals(e.getTeamId(), teamId)
                            && (update.getTenantName() == null || e.belongsTo(update.getTenantName())))
                    .findFirst();

            if (existing.isEmpty()) {
                log.debug("Incremental update for unknown entity {} ({}) in team {}",
                        update.getEntityName(), update.getEntityType(), update.getTeamName());
                return Optional.empty();
            }

            Instant now = clock.instant();
            SlaEntity updated = patch(existing.get(), update, now);

            List<SlaEntity> entities = current.getEntities().stream()
                    .map(e -> e == existing.get() ? updated : e)
                    .collect(Collectors.toList());

            EntityChange change = EntityChange.builder()
                    .entityId(updated.getId())
                    .entityName(updated.getName())
                    .entityType(updated.getType().getValue())
                    .teamName(update.getTeamName())
                    .teamId(teamId)
                    .tenantName(updated.getTenantName())
                    .entity(updated)
                    .changedAt(now)
                    .build();

            List<EntityChange> changes = new ArrayList<>(retainedChanges(current, now));
            changes.add(change);

            long version = versionSequence.incrementAndGet();
            CacheSnapshot next = CacheSnapshot.build(version, entities, current.getTeams(),
                    current.getTenants(), changes, current.getLastUpdated(), aggregator);
            install(next);

            log.info("Applied incremental update to {} ({}), snapshot version {}",
                    updated.getName(), updated.getType().getValue(), version);

            eventPublisher.publishEvent(new EntityChangedEvent(change, version));
            return Optional.of(change);

        } finally {
            refreshLock.unlock();
        }
    }

    private static SlaEntity patch(SlaEntity entity, IncrementalUpdateRequest update, Instant now) {
        SlaEntity.SlaEntityBuilder builder = entity.toBuilder()
                .lastRefreshed(update.getLastRefreshed() != null ? update.getLastRefreshed() : now);
        if (update.getCurrentSla() != null) {
            builder.currentSla(update.getCurrentSla());
        }
        if (update.getSlaTarget() != null) {
            builder.slaTarget(update.getSlaTarget());
        }
        if (update.getStatus() != null) {
            builder.status(update.getStatus());
        }
        return builder.build();
    }

    private void install(CacheSnapshot next) {
        if (state.get() == CacheState.STOPPED) {
            log.debug("Cache stopped, discarding snapshot version {}", next.getVersion());
            return;
        }

        CacheSnapshot installed = snapshot.accumulateAndGet(next, (current, candidate) ->
                current == null || candidate.getVersion() > current.getVersion() ? candidate : current);

        if (installed != next) {
            log.warn("Discarded snapshot version {}: version {} already installed",
                    next.getVersion(), installed.getVersion());
            return;
        }

        state.updateAndGet(s -> s == CacheState.STOPPED ? s : CacheState.READY);
    }

    private List<EntityChange> retainedChanges(CacheSnapshot current, Instant now) {
        if (current == null) {
            return List.of();
        }
        Instant cutoff = now.minus(settings.getRecentChangesWindow());
        return current.getRecentChanges().stream()
                .filter(c -> c.getChangedAt().isAfter(cutoff))
                .collect(Collectors.toList());
    }

    private void scheduleNext(Duration delay) {
        synchronized (scheduleMonitor) {
            if (nextRefresh != null) {
                nextRefresh.cancel(false);
                nextRefresh = null;
            }
            if (state.get() == CacheState.STOPPED) {
                return;
            }
            nextRefresh = taskScheduler.schedule(this::runScheduledRefresh, clock.instant().plus(delay));
            log.debug("Next cache refresh in {}", delay);
        }
    }

    private Duration nextDelay() {
        return snapshot.get() != null ? settings.getRefreshInterval() : settings.getInitialRetryDelay();
    }

    // ============================================================
    // Reads
    // ============================================================

    public CacheSnapshot getSnapshot() {
        return requireSnapshot();
    }

    public List<SlaEntity> getAllEntities() {
        return requireSnapshot().getEntities();
    }

    public List<SlaEntity> getEntitiesByTenant(String tenantName) {
        return requireSnapshot().entitiesForTenant(tenantName);
    }

    public List<SlaEntity> getEntitiesByTeam(String tenantName, Long teamId) {
        return requireSnapshot().entitiesForTeam(tenantName, teamId);
    }

    public List<Team> getAllTeams() {
        return requireSnapshot().getTeams();
    }

    public List<Team> getTeamsByTenant(String tenantName) {
        return requireSnapshot().teamsForTenant(tenantName);
    }

    public List<Tenant> getAllTenants() {
        return requireSnapshot().getTenants();
    }

    /**
     * Precomputed default-range metrics for a tenant.
     */
    public Optional<DashboardMetrics> getMetrics(String tenantName) {
        return Optional.ofNullable(requireSnapshot().getMetricsByTenant().get(tenantName));
    }

    public Optional<DashboardMetrics> getTeamMetrics(String tenantName, Long teamId) {
        CacheSnapshot current = requireSnapshot();
        Map<Long, DashboardMetrics> byTeam = current.getMetricsByTeam().get(tenantName);
        if (byTeam == null) {
            return Optional.empty();
        }
        return Optional.of(byTeam.getOrDefault(teamId, DashboardMetrics.empty()));
    }

    /**
     * Metrics over the tenant's entities (optionally one team's) last refreshed within
     * {@code [startDate, endDate]}, both days inclusive in UTC.
     */
    public DashboardMetrics calculateMetricsForDateRange(String tenantName, Long teamId,
                                                         LocalDate startDate, LocalDate endDate) {
        CacheSnapshot current = requireSnapshot();
        Instant from = startDate.atStartOfDay(ZoneOffset.UTC).toInstant();
        Instant to = endDate.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant();

        List<SlaEntity> inRange = current.entitiesForTenant(tenantName).stream()
                .filter(e -> teamId == null || Objects.equals(e.getTeamId(), teamId))
                .filter(e -> e.getLastRefreshed() != null
                        && !e.getLastRefreshed().isBefore(from)
                        && e.getLastRefreshed().isBefore(to))
                .collect(Collectors.toList());

        return aggregator.computeMetrics(inRange);
    }

    /**
     * Changes within the recent-changes window, newest first, optionally filtered by tenant and team name.
     */
    public List<EntityChange> getRecentChanges(String tenantName, String teamName) {
        CacheSnapshot current = requireSnapshot();
        Instant cutoff = clock.instant().minus(settings.getRecentChangesWindow());

        List<EntityChange> changes = current.getRecentChanges().stream()
                .filter(c -> c.getChangedAt().isAfter(cutoff))
                .filter(c -> tenantName == null || tenantName.equals(c.getTenantName()))
                .filter(c -> teamName == null || teamName.equals(c.getTeamName()))
                .collect(Collectors.toCollection(ArrayList::new));
        Collections.reverse(changes);
        return changes;
    }

    public CacheStatus getCacheStatus() {
        CacheSnapshot current = snapshot.get();
        if (current == null) {
            return CacheStatus.builder()
                    .loaded(false)
                    .state(state.get())
                    .build();
        }
        return CacheStatus.builder()
                .loaded(true)
                .state(state.get())
                .version(current.getVersion())
                .lastUpdated(current.getLastUpdated())
                .entitiesCount(current.getEntities().size())
                .teamsCount(current.getTeams().size())
                .tenantsCount(current.getTenants().size())
                .recentChangesCount(current.getRecentChanges().size())
                .build();
    }

    public CacheState getState() {
        return state.get();
    }

    /**
     * Seconds since the installed snapshot was loaded from the store, 0 before the first load.
     */
    public double getAgeSeconds() {
        CacheSnapshot current = snapshot.get();
        if (current == null) {
            return 0;
        }
        return Duration.between(current.getLastUpdated(), clock.instant()).toMillis() / 1000.0;
    }

    private long currentVersion() {
        CacheSnapshot current = snapshot.get();
        return current != null ? current.getVersion() : 0;
    }

    private CacheSnapshot requireSnapshot() {
        CacheSnapshot current = snapshot.get();
        if (current == null) {
            throw new CacheNotReadyException(state.get());
        }
        return current;
    }
}
