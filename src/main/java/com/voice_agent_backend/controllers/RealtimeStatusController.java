package com.voice_agent_backend.controllers;

import com.voice_agent_backend.config.RealtimeConfig;
import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.services.ActiveSessionRegistry;
import com.voice_agent_backend.services.RateLimitingService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/realtime")
@RequiredArgsConstructor
public class RealtimeStatusController {

    private final ActiveSessionRegistry activeSessionRegistry;
    private final RateLimitingService rateLimitingService;
    private final RealtimeConfig realtimeConfig;
    private final SessionConfig sessionConfig;

    @GetMapping("/status")
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new HashMap<>();
        status.put("websocketEnabled", true);
        status.put("timestamp", LocalDateTime.now());
        status.put("endpoint", RealtimeWebSocketHandler.PATH_PREFIX + "{agentId}");
        status.put("model", realtimeConfig.getModel());
        status.put("eligibleTier", sessionConfig.getEligibleTier());
        status.put("defaultApiKeyConfigured", realtimeConfig.hasDefaultApiKey());
        status.put("sessions", activeSessionRegistry.getSessionStatistics());
        status.put("rateLimits", rateLimitingService.getGlobalRateLimitStatus());
        return status;
    }

    @GetMapping("/sessions")
    public List<Map<String, Object>> getActiveSessions() {
        return activeSessionRegistry.getActiveSessions();
    }
}
