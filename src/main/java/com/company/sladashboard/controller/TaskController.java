package com.company.sladashboard.controller;

import com.company.sladashboard.domain.DagTask;
import com.company.sladashboard.dto.request.TaskPriorityRequest;
import com.company.sladashboard.dto.request.TaskRequest;
import com.company.sladashboard.service.EntityMutationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "DAG Tasks", description = "Tasks of DAG entities")
@RequiredArgsConstructor
@SecurityRequirement(name = "bearer-jwt")
public class TaskController {

    private final EntityMutationService mutationService;

    @GetMapping("/dags/{dagId}/tasks")
    @Operation(summary = "List a DAG's tasks")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<DagTask>> listTasks(@PathVariable long dagId) {
        return ResponseEntity.ok(mutationService.listTasks(dagId));
    }

    @PostMapping("/dags/{dagId}/tasks")
    @Operation(summary = "Create a task")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<DagTask> createTask(@PathVariable long dagId,
                                             @Valid @RequestBody TaskRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mutationService.createTask(dagId, request));
    }

    @PutMapping("/tasks/{taskId}")
    @Operation(summary = "Update a task")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<DagTask> updateTask(@PathVariable long taskId,
                                              @Valid @RequestBody TaskRequest request) {
        return ResponseEntity.ok(mutationService.updateTask(taskId, request));
    }

    @DeleteMapping("/tasks/{taskId}")
    @Operation(summary = "Delete a task")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Void> deleteTask(@PathVariable long taskId) {
        mutationService.deleteTask(taskId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/tasks/{taskId}/priority")
    @Operation(
            summary = "Change a task's priority",
            description = "Also invalidates the owning team's dashboard"
    )
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<DagTask> changePriority(@PathVariable long taskId,
                                                  @Valid @RequestBody TaskPriorityRequest request) {
        return ResponseEntity.ok(mutationService.changeTaskPriority(taskId, request.getPriority()));
    }
}
