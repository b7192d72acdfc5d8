package com.company.sladashboard.dto.request;

import com.company.sladashboard.domain.enums.EntityStatus;
import com.company.sladashboard.domain.enums.EntityType;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Body of entity create and update calls. On update, null fields are left unchanged.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntityRequest {

    @Size(max = 255)
    private String name;

    private EntityType type;

    private String tenantName;

    private Long teamId;

    private String description;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double slaTarget;

    @DecimalMin("0.0")
    @DecimalMax("100.0")
    private Double currentSla;

    private EntityStatus status;

    private String refreshFrequency;

    private Instant lastRefreshed;

    private String owner;

    @Email
    private String ownerEmail;
}
