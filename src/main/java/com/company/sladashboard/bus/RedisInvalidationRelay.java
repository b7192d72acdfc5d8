package com.company.sladashboard.bus;

import com.company.sladashboard.config.SlaDashboardProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Relays bus events between instances over Redis pub/sub.
 * Messages carry the publishing instance id; an instance ignores its own messages.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(
        value = "sladashboard.bus.redis.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class RedisInvalidationRelay implements MessageListener {

    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final InvalidationBus invalidationBus;
    private final ObjectMapper objectMapper;
    private final SlaDashboardProperties properties;
    private final MeterRegistry meterRegistry;

    @PostConstruct
    void subscribe() {
        String channel = properties.getBus().getRedis().getChannel();
        listenerContainer.addMessageListener(this, new ChannelTopic(channel));
        log.info("[Bus Relay] Subscribed to channel {} as instance {}", channel, invalidationBus.getInstanceId());
    }

    public void relay(InvalidationEvent event) {
        String channel = properties.getBus().getRedis().getChannel();
        try {
            redisTemplate.convertAndSend(channel, objectMapper.writeValueAsString(event));
            meterRegistry.counter("sla.bus.relay", "direction", "out").increment();
        } catch (JsonProcessingException e) {
            log.error("[Bus Relay] Failed to serialise event {}", event.getEvent(), e);
        } catch (DataAccessException e) {
            log.warn("[Bus Relay] Failed to publish {} on {}: {}", event.getEvent(), channel, e.getMessage());
            meterRegistry.counter("sla.bus.relay.failures").increment();
        }
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        String body = new String(message.getBody(), StandardCharsets.UTF_8);
        InvalidationEvent event;
        try {
            event = objectMapper.readValue(body, InvalidationEvent.class);
        } catch (JsonProcessingException e) {
            log.warn("[Bus Relay] Ignoring malformed message: {}", e.getOriginalMessage());
            return;
        }

        if (invalidationBus.getInstanceId().equals(event.getOrigin())) {
            return;
        }

        log.debug("[Bus Relay] Received {} from instance {}", event.getEvent(), event.getOrigin());
        meterRegistry.counter("sla.bus.relay", "direction", "in").increment();
        invalidationBus.publishRelayed(event);
    }
}
