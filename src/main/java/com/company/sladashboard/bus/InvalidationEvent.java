package com.company.sladashboard.bus;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Event frame pushed to every interested bus session:
 * {@code {event, affectedKeys, context, timestamp}}.
 * {@code origin} identifies the publishing instance when events are relayed between instances.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InvalidationEvent {

    public static final String CACHE_UPDATED = "cache-updated";
    public static final String ENTITY_UPDATED = "entity-updated";

    String event;
    List<String> affectedKeys;
    Map<String, Object> context;
    Instant timestamp;
    String origin;

    public InvalidationEvent withOrigin(String instanceId) {
        return new InvalidationEvent(event, affectedKeys, context, timestamp, instanceId);
    }
}
