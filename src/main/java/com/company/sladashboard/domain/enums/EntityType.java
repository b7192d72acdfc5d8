package com.company.sladashboard.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntityType {
    TABLE("table"),
    DAG("dag");

    private final String value;

    EntityType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EntityType fromString(String type) {
        if (type == null) {
            return TABLE;
        }
        for (EntityType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(type) || candidate.name().equalsIgnoreCase(type)) {
                return candidate;
            }
        }
        return TABLE;
    }
}
