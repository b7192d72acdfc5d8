package com.company.sladashboard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Team {
    Long id;
    String name;
    String description;
    Instant createdAt;
}
