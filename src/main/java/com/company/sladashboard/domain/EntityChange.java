package com.company.sladashboard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One incremental update recorded in the snapshot's recent-changes window.
 */
@Value
@Builder
@Jacksonized
public class EntityChange {
    Long entityId;
    String entityName;
    String entityType;
    String teamName;
    String tenantName;
    Long teamId;
    SlaEntity entity;
    Instant changedAt;
}
