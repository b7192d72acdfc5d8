package com.company.sladashboard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Health of an entity relative to its SLA target.
 */
public enum EntityStatus {
    HEALTHY,
    WARNING,
    CRITICAL;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static EntityStatus fromString(String status) {
        if (status == null) {
            return HEALTHY;
        }
        try {
            return EntityStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return HEALTHY;
        }
    }
}
