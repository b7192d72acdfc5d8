package com.company.sladashboard.config;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.data.redis.LettuceClientConfigurationBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.Executors;

/**
 * Pub/sub plumbing for the multi-instance bus relay. The connection itself comes from
 * {@code spring.data.redis.*}; this only tunes the Lettuce client and adds a listener container.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(
        value = "sladashboard.bus.redis.enabled",
        havingValue = "true",
        matchIfMissing = false
)
public class RedisBusConfig {

    @Bean
    public LettuceClientConfigurationBuilderCustomizer busLettuceCustomizer() {
        return builder -> builder
                .commandTimeout(Duration.ofSeconds(2))
                .clientOptions(ClientOptions.builder()
                        .autoReconnect(true)
                        .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
                        .socketOptions(SocketOptions.builder()
                                .connectTimeout(Duration.ofSeconds(5))
                                .keepAlive(true)
                                .build())
                        .build());
    }

    @Bean
    public RedisMessageListenerContainer busListenerContainer(RedisConnectionFactory connectionFactory,
                                                              SlaDashboardProperties properties) {
        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        // relayed events are handed to the bus publisher, one listener thread keeps them ordered
        container.setTaskExecutor(Executors.newSingleThreadExecutor(new CustomizableThreadFactory("sla-bus-relay-")));
        container.setErrorHandler(t -> log.warn("[Bus Relay] Listener failed: {}", t.getMessage()));
        log.info("Redis bus relay enabled on channel {}", properties.getBus().getRedis().getChannel());
        return container;
    }
}
