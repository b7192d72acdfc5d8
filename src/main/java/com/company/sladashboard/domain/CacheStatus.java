package com.company.sladashboard.domain;

import com.company.sladashboard.domain.enums.CacheState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CacheStatus {

    @JsonProperty("isLoaded")
    boolean loaded;

    CacheState state;
    long version;
    Instant lastUpdated;
    int entitiesCount;
    int teamsCount;
    int tenantsCount;
    int recentChangesCount;
}
