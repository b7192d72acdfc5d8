package com.company.sladashboard.config;

import com.company.sladashboard.bus.DashboardWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final DashboardWebSocketHandler webSocketHandler;
    private final SlaDashboardProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        SlaDashboardProperties.Bus bus = properties.getBus();
        registry.addHandler(webSocketHandler, bus.getPath())
                .setAllowedOriginPatterns(bus.getAllowedOrigins().toArray(new String[0]));
    }
}
