package com.company.sladashboard.controller;

import com.company.sladashboard.domain.SlaEntity;
import com.company.sladashboard.domain.Team;
import com.company.sladashboard.domain.Tenant;
import com.company.sladashboard.dto.request.EntityRequest;
import com.company.sladashboard.dto.request.TeamMemberRequest;
import com.company.sladashboard.dto.request.TeamRequest;
import com.company.sladashboard.dto.request.TenantRequest;
import com.company.sladashboard.service.EntityMutationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Write surface for entities, teams, team members and tenants. Each call is followed by
 * an invalidation event on the bus.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Entities", description = "Create and update entities, teams and tenants")
@RequiredArgsConstructor
@Slf4j
@SecurityRequirement(name = "bearer-jwt")
public class EntityMutationController {

    private final EntityMutationService mutationService;

    @PostMapping("/entities")
    @Operation(summary = "Create an entity")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<SlaEntity> createEntity(@Valid @RequestBody EntityRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mutationService.createEntity(request));
    }

    @PutMapping("/entities/{entityId}")
    @Operation(summary = "Update an entity", description = "Null fields are left unchanged")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<SlaEntity> updateEntity(@PathVariable long entityId,
                                                  @Valid @RequestBody EntityRequest request) {
        return ResponseEntity.ok(mutationService.updateEntity(entityId, request));
    }

    @DeleteMapping("/entities/{entityId}")
    @Operation(summary = "Delete an entity")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Void> deleteEntity(@PathVariable long entityId) {
        mutationService.deleteEntity(entityId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/teams")
    @Operation(summary = "Create a team")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Team> createTeam(@Valid @RequestBody TeamRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mutationService.createTeam(request));
    }

    @PutMapping("/teams/{teamId}")
    @Operation(summary = "Update a team")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Team> updateTeam(@PathVariable long teamId,
                                           @Valid @RequestBody TeamRequest request) {
        return ResponseEntity.ok(mutationService.updateTeam(teamId, request));
    }

    @GetMapping("/teams/{teamName}/members")
    @Operation(summary = "List team members")
    @PreAuthorize("hasAnyRole('UI_READER', 'ADMIN')")
    public ResponseEntity<List<String>> getTeamMembers(@PathVariable String teamName) {
        return ResponseEntity.ok(mutationService.listTeamMembers(teamName));
    }

    @PostMapping("/teams/{teamName}/members")
    @Operation(summary = "Add a team member")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<List<String>> addTeamMember(@PathVariable String teamName,
                                                      @Valid @RequestBody TeamMemberRequest request) {
        return ResponseEntity.ok(mutationService.addTeamMember(teamName, request.getMemberId()));
    }

    @DeleteMapping("/teams/{teamName}/members/{memberId}")
    @Operation(summary = "Remove a team member")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<List<String>> removeTeamMember(@PathVariable String teamName,
                                                         @PathVariable String memberId) {
        return ResponseEntity.ok(mutationService.removeTeamMember(teamName, memberId));
    }

    @PostMapping("/tenants")
    @Operation(summary = "Create a tenant")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Tenant> createTenant(@Valid @RequestBody TenantRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(mutationService.createTenant(request));
    }

    @PutMapping("/tenants/{tenantId}")
    @Operation(summary = "Update a tenant")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public ResponseEntity<Tenant> updateTenant(@PathVariable long tenantId,
                                               @Valid @RequestBody TenantRequest request) {
        return ResponseEntity.ok(mutationService.updateTenant(tenantId, request));
    }
}
