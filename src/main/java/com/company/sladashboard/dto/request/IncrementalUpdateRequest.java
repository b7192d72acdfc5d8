package com.company.sladashboard.dto.request;

import com.company.sladashboard.domain.enums.EntityStatus;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Change notification from the SLA poller for a single entity, identified by name, type and team.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IncrementalUpdateRequest {

    @NotBlank(message = "Entity name is required")
    private String entityName;

    @NotBlank(message = "Entity type is required")
    private String entityType;

    @NotBlank(message = "Team name is required")
    private String teamName;

    private String tenantName;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double currentSla;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double slaTarget;

    private EntityStatus status;

    private Instant lastRefreshed;
}
