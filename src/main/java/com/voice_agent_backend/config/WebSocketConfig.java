package com.voice_agent_backend.config;

import com.voice_agent_backend.controllers.RealtimeWebSocketHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeWebSocketHandler realtimeWebSocketHandler;
    private final SessionConfig sessionConfig;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Browser and telephony media streams, one socket per call
        registry.addHandler(realtimeWebSocketHandler, RealtimeWebSocketHandler.PATH_PREFIX + "{agentId}")
                .setAllowedOriginPatterns("*");
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxBinaryMessageBufferSize(sessionConfig.getMaxBinaryMessageBytes());
        container.setMaxTextMessageBufferSize(sessionConfig.getMaxTextMessageBytes());
        return container;
    }
}
