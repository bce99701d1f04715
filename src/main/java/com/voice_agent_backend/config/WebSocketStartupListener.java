package com.voice_agent_backend.config;

import com.voice_agent_backend.controllers.RealtimeWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
@RequiredArgsConstructor
public class WebSocketStartupListener {

    private final RealtimeConfig realtimeConfig;
    private final SessionConfig sessionConfig;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("=".repeat(60));
        log.info("VOICE AGENT BACKEND STARTED");
        log.info("Realtime endpoint: ws://<host>{}<agentId>", RealtimeWebSocketHandler.PATH_PREFIX);
        log.info("Upstream model: {} ({})", realtimeConfig.getModel(), realtimeConfig.getBaseUrl());
        log.info("Eligible tier: {}", sessionConfig.getEligibleTier());
        if (!realtimeConfig.hasDefaultApiKey()) {
            log.warn("No default OpenAI API key configured; sessions need a per-user key");
        }
        log.info("=".repeat(60));
    }
}
