package com.company.sladashboard.repository;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.domain.enums.EntityStatus;
import com.company.sladashboard.domain.enums.EntityType;
import com.company.sladashboard.domain.enums.TaskPriority;
import com.company.sladashboard.exception.EntityNotFoundException;
import com.company.sladashboard.exception.MutationRejectedException;
import com.company.sladashboard.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * PostgreSQL entity store. Inserts and updates use RETURNING so callers get the row as stored.
 */
@Repository
@RequiredArgsConstructor
@Slf4j
public class JdbcEntityStore implements EntityStore {

    private final JdbcTemplate jdbcTemplate;

    private static final String ENTITY_COLUMNS = """
        id, name, type, tenant_name, team_id, description, sla_target, current_sla,
        status, refresh_frequency, last_refreshed, owner, owner_email, is_active
        """;

    private static final String SELECT_ENTITIES = "SELECT " + ENTITY_COLUMNS + " FROM entities ";

    private static final String TASK_COLUMNS = """
        id, dag_id, name, description, priority, task_type, status, updated_at
        """;

    private static final String SELECT_TASKS = "SELECT " + TASK_COLUMNS + " FROM dag_tasks ";

    // ============================================================
    // Reads
    // ============================================================

    @Override
    public List<SlaEntity> listEntities() {
        return read("listEntities", () -> jdbcTemplate.query(
                SELECT_ENTITIES + "WHERE is_active = TRUE ORDER BY id",
                new SlaEntityRowMapper()));
    }

    @Override
    public List<Team> listTeams() {
        return read("listTeams", () -> jdbcTemplate.query(
                "SELECT id, name, description, created_at FROM teams ORDER BY name",
                new TeamRowMapper()));
    }

    @Override
    public List<Tenant> listTenants() {
        return read("listTenants", () -> jdbcTemplate.query(
                "SELECT id, name, description, is_active FROM tenants WHERE is_active = TRUE ORDER BY name",
                new TenantRowMapper()));
    }

    @Override
    public Optional<SlaEntity> findEntity(long entityId) {
        return read("findEntity", () -> jdbcTemplate.query(
                SELECT_ENTITIES + "WHERE id = ?", new SlaEntityRowMapper(), entityId)
                .stream().findFirst());
    }

    @Override
    public Optional<Team> findTeam(long teamId) {
        return read("findTeam", () -> jdbcTemplate.query(
                "SELECT id, name, description, created_at FROM teams WHERE id = ?",
                new TeamRowMapper(), teamId)
                .stream().findFirst());
    }

    @Override
    public Optional<Tenant> findTenant(long tenantId) {
        return read("findTenant", () -> jdbcTemplate.query(
                "SELECT id, name, description, is_active FROM tenants WHERE id = ?",
                new TenantRowMapper(), tenantId)
                .stream().findFirst());
    }

    @Override
    public List<String> listTeamMembers(String teamName) {
        return read("listTeamMembers", () -> jdbcTemplate.queryForList("""
                SELECT m.member_id
                FROM team_members m
                JOIN teams t ON t.id = m.team_id
                WHERE t.name = ?
                ORDER BY m.member_id
                """, String.class, teamName));
    }

    @Override
    public List<DagTask> listTasks(long dagId) {
        return read("listTasks", () -> jdbcTemplate.query(
                SELECT_TASKS + "WHERE dag_id = ? ORDER BY CASE priority WHEN 'HIGH' THEN 0 ELSE 1 END, id",
                new DagTaskRowMapper(), dagId));
    }

    @Override
    public Optional<DagTask> findTask(long taskId) {
        return read("findTask", () -> jdbcTemplate.query(
                SELECT_TASKS + "WHERE id = ?", new DagTaskRowMapper(), taskId)
                .stream().findFirst());
    }

    // ============================================================
    // Writes
    // ============================================================

    @Override
    public SlaEntity createEntity(SlaEntity entity) {
        return write("createEntity", "Entity", null, () -> jdbcTemplate.queryForObject(
                """
                INSERT INTO entities (name, type, tenant_name, team_id, description, sla_target, current_sla,
                                      status, refresh_frequency, last_refreshed, owner, owner_email, is_active)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, TRUE)
                RETURNING
                """ + ENTITY_COLUMNS,
                new SlaEntityRowMapper(),
                entity.getName(), typeOf(entity), entity.getTenantName(), entity.getTeamId(),
                entity.getDescription(), entity.getSlaTarget(), entity.getCurrentSla(),
                statusOf(entity), entity.getRefreshFrequency(), toTimestamp(entity.getLastRefreshed()),
                entity.getOwner(), entity.getOwnerEmail()));
    }

    @Override
    public SlaEntity updateEntity(long entityId, SlaEntity entity) {
        return write("updateEntity", "Entity", entityId, () -> jdbcTemplate.queryForObject(
                """
                UPDATE entities
                SET name = COALESCE(?, name),
                    type = COALESCE(?, type),
                    tenant_name = COALESCE(?, tenant_name),
                    team_id = COALESCE(?, team_id),
                    description = COALESCE(?, description),
                    sla_target = COALESCE(?, sla_target),
                    current_sla = COALESCE(?, current_sla),
                    status = COALESCE(?, status),
                    refresh_frequency = COALESCE(?, refresh_frequency),
                    last_refreshed = COALESCE(?, last_refreshed),
                    owner = COALESCE(?, owner),
                    owner_email = COALESCE(?, owner_email)
                WHERE id = ?
                RETURNING
                """ + ENTITY_COLUMNS,
                new SlaEntityRowMapper(),
                entity.getName(), entity.getType() != null ? typeOf(entity) : null,
                entity.getTenantName(), entity.getTeamId(), entity.getDescription(),
                entity.getSlaTarget(), entity.getCurrentSla(),
                entity.getStatus() != null ? statusOf(entity) : null,
                entity.getRefreshFrequency(), toTimestamp(entity.getLastRefreshed()),
                entity.getOwner(), entity.getOwnerEmail(), entityId));
    }

    @Override
    public void deleteEntity(long entityId) {
        int rows = write("deleteEntity", "Entity", entityId,
                () -> jdbcTemplate.update("DELETE FROM entities WHERE id = ?", entityId));
        requireRow(rows, "Entity", entityId);
    }

    @Override
    public Team createTeam(Team team) {
        return write("createTeam", "Team", null, () -> jdbcTemplate.queryForObject("""
                INSERT INTO teams (name, description, created_at)
                VALUES (?, ?, NOW())
                RETURNING id, name, description, created_at
                """, new TeamRowMapper(), team.getName(), team.getDescription()));
    }

    @Override
    public Team updateTeam(long teamId, Team team) {
        return write("updateTeam", "Team", teamId, () -> jdbcTemplate.queryForObject("""
                UPDATE teams
                SET name = COALESCE(?, name),
                    description = COALESCE(?, description)
                WHERE id = ?
                RETURNING id, name, description, created_at
                """, new TeamRowMapper(), team.getName(), team.getDescription(), teamId));
    }

    @Override
    public void addTeamMember(String teamName, String memberId) {
        int rows = write("addTeamMember", "Team", teamName, () -> jdbcTemplate.update("""
                INSERT INTO team_members (team_id, member_id)
                SELECT id, ? FROM teams WHERE name = ?
                ON CONFLICT DO NOTHING
                """, memberId, teamName));
        log.debug("Added member {} to team {} ({} rows)", memberId, teamName, rows);
    }

    @Override
    public void removeTeamMember(String teamName, String memberId) {
        int rows = write("removeTeamMember", "Team member", memberId, () -> jdbcTemplate.update("""
                DELETE FROM team_members
                WHERE member_id = ?
                AND team_id = (SELECT id FROM teams WHERE name = ?)
                """, memberId, teamName));
        requireRow(rows, "Team member", teamName + "/" + memberId);
    }

    @Override
    public Tenant createTenant(Tenant tenant) {
        return write("createTenant", "Tenant", null, () -> jdbcTemplate.queryForObject("""
                INSERT INTO tenants (name, description, is_active)
                VALUES (?, ?, COALESCE(?, TRUE))
                RETURNING id, name, description, is_active
                """, new TenantRowMapper(), tenant.getName(), tenant.getDescription(), tenant.getActive()));
    }

    @Override
    public Tenant updateTenant(long tenantId, Tenant tenant) {
        return write("updateTenant", "Tenant", tenantId, () -> jdbcTemplate.queryForObject("""
                UPDATE tenants
                SET name = COALESCE(?, name),
                    description = COALESCE(?, description),
                    is_active = COALESCE(?, is_active)
                WHERE id = ?
                RETURNING id, name, description, is_active
                """, new TenantRowMapper(), tenant.getName(), tenant.getDescription(), tenant.getActive(), tenantId));
    }

    @Override
    public DagTask createTask(DagTask task) {
        TaskPriority priority = task.getPriority() != null ? task.getPriority() : TaskPriority.NORMAL;
        return write("createTask", "Task", null, () -> jdbcTemplate.queryForObject(
                """
                INSERT INTO dag_tasks (dag_id, name, description, priority, task_type, status, updated_at)
                VALUES (?, ?, ?, ?, ?, ?, NOW())
                RETURNING
                """ + TASK_COLUMNS,
                new DagTaskRowMapper(),
                task.getDagId(), task.getName(), task.getDescription(),
                priority.name(), priority.getTaskType(), task.getStatus()));
    }

    @Override
    public DagTask updateTask(long taskId, DagTask task) {
        return write("updateTask", "Task", taskId, () -> jdbcTemplate.queryForObject(
                """
                UPDATE dag_tasks
                SET name = COALESCE(?, name),
                    description = COALESCE(?, description),
                    status = COALESCE(?, status),
                    updated_at = NOW()
                WHERE id = ?
                RETURNING
                """ + TASK_COLUMNS,
                new DagTaskRowMapper(),
                task.getName(), task.getDescription(), task.getStatus(), taskId));
    }

    @Override
    public void deleteTask(long taskId) {
        int rows = write("deleteTask", "Task", taskId,
                () -> jdbcTemplate.update("DELETE FROM dag_tasks WHERE id = ?", taskId));
        requireRow(rows, "Task", taskId);
    }

    @Override
    public DagTask updateTaskPriority(long taskId, TaskPriority priority) {
        return write("updateTaskPriority", "Task", taskId, () -> jdbcTemplate.queryForObject(
                """
                UPDATE dag_tasks
                SET priority = ?, task_type = ?, updated_at = NOW()
                WHERE id = ?
                RETURNING
                """ + TASK_COLUMNS,
                new DagTaskRowMapper(),
                priority.name(), priority.getTaskType(), taskId));
    }

    // ============================================================
    // Error translation
    // ============================================================

    private <T> T read(String operation, Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("Store read {} failed", operation, e);
            throw new StoreUnavailableException(operation, e);
        }
    }

    private <T> T write(String operation, String kind, Object id, Supplier<T> statement) {
        try {
            return statement.get();
        } catch (EmptyResultDataAccessException e) {
            throw new EntityNotFoundException(kind, id);
        } catch (DataIntegrityViolationException e) {
            log.warn("Store rejected {}: {}", operation, e.getMostSpecificCause().getMessage());
            throw new MutationRejectedException(409, kind + " rejected by store: "
                    + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException e) {
            log.error("Store write {} failed", operation, e);
            throw new StoreUnavailableException(operation, e);
        }
    }

    private static void requireRow(int rows, String kind, Object id) {
        if (rows == 0) {
            throw new EntityNotFoundException(kind, id);
        }
    }

    private static String typeOf(SlaEntity entity) {
        return entity.getType() != null ? entity.getType().getValue() : EntityType.TABLE.getValue();
    }

    private static String statusOf(SlaEntity entity) {
        return entity.getStatus() != null ? entity.getStatus().name().toLowerCase() : "healthy";
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static Double getNullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getNullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    // ============================================================
    // Row mappers
    // ============================================================

    private static class SlaEntityRowMapper implements RowMapper<SlaEntity> {
        @Override
        public SlaEntity mapRow(ResultSet rs, int rowNum) throws SQLException {
            return SlaEntity.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .type(EntityType.fromString(rs.getString("type")))
                    .tenantName(rs.getString("tenant_name"))
                    .teamId(getNullableLong(rs, "team_id"))
                    .description(rs.getString("description"))
                    .slaTarget(getNullableDouble(rs, "sla_target"))
                    .currentSla(getNullableDouble(rs, "current_sla"))
                    .status(EntityStatus.fromString(rs.getString("status")))
                    .refreshFrequency(rs.getString("refresh_frequency"))
                    .lastRefreshed(toInstant(rs.getTimestamp("last_refreshed")))
                    .owner(rs.getString("owner"))
                    .ownerEmail(rs.getString("owner_email"))
                    .active(rs.getBoolean("is_active"))
                    .build();
        }
    }

    private static class TeamRowMapper implements RowMapper<Team> {
        @Override
        public Team mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Team.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .createdAt(toInstant(rs.getTimestamp("created_at")))
                    .build();
        }
    }

    private static class TenantRowMapper implements RowMapper<Tenant> {
        @Override
        public Tenant mapRow(ResultSet rs, int rowNum) throws SQLException {
            return Tenant.builder()
                    .id(rs.getLong("id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .active(rs.getBoolean("is_active"))
                    .build();
        }
    }

    private static class DagTaskRowMapper implements RowMapper<DagTask> {
        @Override
        public DagTask mapRow(ResultSet rs, int rowNum) throws SQLException {
            return DagTask.builder()
                    .id(rs.getLong("id"))
                    .dagId(rs.getLong("dag_id"))
                    .name(rs.getString("name"))
                    .description(rs.getString("description"))
                    .priority(TaskPriority.fromString(rs.getString("priority")))
                    .taskType(rs.getString("task_type"))
                    .status(rs.getString("status"))
                    .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                    .build();
        }
    }
}
