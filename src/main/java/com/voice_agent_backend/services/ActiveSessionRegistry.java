package com.voice_agent_backend.services;

import com.voice_agent_backend.models.RealtimeSession;
import com.voice_agent_backend.models.SessionState;
import com.voice_agent_backend.models.TerminationCause;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live sessions on this node, for status reporting and shutdown.
 */
@Service
@Slf4j
public class ActiveSessionRegistry {

    private final Map<String, RealtimeSession> activeSessions = new ConcurrentHashMap<>();

    private final AtomicLong sessionsOpened = new AtomicLong();
    private final AtomicLong sessionsFailed = new AtomicLong();

    public void register(RealtimeSession session) {
        activeSessions.put(session.getSessionId(), session);
        sessionsOpened.incrementAndGet();
        log.debug("Registered session {} for agent {}. Active: {}",
                session.getSessionId(), session.getAgentId(), activeSessions.size());
    }

    public void unregister(RealtimeSession session) {
        if (activeSessions.remove(session.getSessionId()) != null && session.getState() == SessionState.FAILED) {
            sessionsFailed.incrementAndGet();
        }
    }

    public int getActiveCount() {
        return activeSessions.size();
    }

    public List<Map<String, Object>> getActiveSessions() {
        List<Map<String, Object>> views = new ArrayList<>();
        for (RealtimeSession session : activeSessions.values()) {
            views.add(describe(session));
        }
        return views;
    }

    public Map<String, Object> getSessionStatistics() {
        return Map.of(
                "activeSessionCount", activeSessions.size(),
                "sessionsOpened", sessionsOpened.get(),
                "sessionsFailed", sessionsFailed.get(),
                "oldestSessionAgeSeconds", activeSessions.values().stream()
                        .map(s -> Duration.between(s.getCreatedAt(), Instant.now()).toSeconds())
                        .max(Long::compareTo)
                        .orElse(0L)
        );
    }

    /**
     * Ask every live session to stop; their gateways release the transports.
     */
    @PreDestroy
    public void shutdown() {
        if (activeSessions.isEmpty()) {
            return;
        }
        log.info("Stopping {} active realtime sessions", activeSessions.size());
        activeSessions.values().forEach(session -> session.terminate(TerminationCause.SHUTDOWN));
    }

    private Map<String, Object> describe(RealtimeSession session) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("sessionId", session.getSessionId());
        view.put("agentId", session.getAgentId());
        view.put("state", session.getState());
        view.put("createdAt", session.getCreatedAt().toString());
        view.put("audioFramesForwarded", session.getAudioFramesForwarded().get());
        view.put("eventsForwarded", session.getEventsForwarded().get());
        view.put("toolCallsCompleted", session.getToolCallsCompleted().get());
        view.put("toolCallsFailed", session.getToolCallsFailed().get());
        return view;
    }
}
