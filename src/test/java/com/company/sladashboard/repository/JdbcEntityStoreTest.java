package com.company.sladashboard.repository;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.enums.TaskPriority;
import com.company.sladashboard.exception.EntityNotFoundException;
import com.company.sladashboard.exception.MutationRejectedException;
import com.company.sladashboard.exception.StoreUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("JdbcEntityStore Tests")
class JdbcEntityStoreTest {

    private static JdbcTemplate failingWith(RuntimeException failure) {
        return mock(JdbcTemplate.class, invocation -> {
            throw failure;
        });
    }

    private static JdbcTemplate updatingRows(int rows) {
        return mock(JdbcTemplate.class, invocation ->
                invocation.getMethod().getReturnType() == int.class ? rows : null);
    }

    @Test
    @DisplayName("A lost connection on read surfaces as StoreUnavailable")
    void testListEntities_ConnectionLost() {
        JdbcEntityStore store = new JdbcEntityStore(failingWith(
                new CannotGetJdbcConnectionException("refused", new SQLException("refused"))));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, store::listEntities);
        assertTrue(ex.getMessage().contains("listEntities"));
    }

    @Test
    @DisplayName("A lost connection on write surfaces as StoreUnavailable")
    void testCreateTask_ConnectionLost() {
        JdbcEntityStore store = new JdbcEntityStore(failingWith(
                new CannotGetJdbcConnectionException("refused", new SQLException("refused"))));
        DagTask task = DagTask.builder().dagId(7L).name("extract").priority(TaskPriority.HIGH).build();

        assertThrows(StoreUnavailableException.class, () -> store.createTask(task));
    }

    @Test
    @DisplayName("A constraint violation is a 409 rejection")
    void testCreateTeam_ConstraintViolation() {
        JdbcEntityStore store = new JdbcEntityStore(failingWith(
                new DataIntegrityViolationException("duplicate key value violates unique constraint \"teams_name_key\"")));

        MutationRejectedException ex = assertThrows(MutationRejectedException.class,
                () -> store.createTeam(Team.builder().name("Core").build()));
        assertEquals(409, ex.getStatus());
        assertTrue(ex.getMessage().startsWith("Team rejected by store"));
    }

    @Test
    @DisplayName("Updating a row that does not exist is not-found")
    void testUpdateEntity_NoRow() {
        JdbcEntityStore store = new JdbcEntityStore(failingWith(new EmptyResultDataAccessException(1)));

        EntityNotFoundException ex = assertThrows(EntityNotFoundException.class,
                () -> store.updateEntity(42L, SlaEntity.builder().currentSla(90.0).build()));
        assertEquals("Entity not found: 42", ex.getMessage());
    }

    @Test
    @DisplayName("Deleting a missing task is not-found")
    void testDeleteTask_NoRow() {
        JdbcEntityStore store = new JdbcEntityStore(updatingRows(0));

        assertThrows(EntityNotFoundException.class, () -> store.deleteTask(5L));
    }

    @Test
    @DisplayName("Deleting an existing task succeeds")
    void testDeleteTask() {
        JdbcEntityStore store = new JdbcEntityStore(updatingRows(1));

        assertDoesNotThrow(() -> store.deleteTask(5L));
    }

    @Test
    @DisplayName("Removing a member that is not in the team is not-found")
    void testRemoveTeamMember_NoRow() {
        JdbcEntityStore store = new JdbcEntityStore(updatingRows(0));

        assertThrows(EntityNotFoundException.class, () -> store.removeTeamMember("Core", "alice"));
    }
}
