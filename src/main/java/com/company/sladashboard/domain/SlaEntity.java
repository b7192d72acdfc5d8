package com.company.sladashboard.domain;

import com.company.sladashboard.domain.enums.EntityStatus;
import com.company.sladashboard.domain.enums.EntityType;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * A monitored table or DAG. Instances held by a snapshot are never mutated;
 * changes are made by building a copy with {@code toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SlaEntity {

    Long id;
    String name;
    EntityType type;
    String tenantName;
    Long teamId;
    String description;

    // SLA compliance, 0-100
    Double slaTarget;
    Double currentSla;

    EntityStatus status;
    String refreshFrequency;
    Instant lastRefreshed;

    String owner;
    String ownerEmail;
    Boolean active;

    public boolean isDag() {
        return type == EntityType.DAG;
    }

    public boolean belongsTo(String tenant) {
        return tenantName != null && tenantName.equals(tenant);
    }
}
