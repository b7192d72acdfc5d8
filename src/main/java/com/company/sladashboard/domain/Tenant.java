package com.company.sladashboard.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class Tenant {
    Long id;
    String name;
    String description;
    Boolean active;
}
