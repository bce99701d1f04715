package com.voice_agent_backend.services.realtime;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.config.RealtimeConfig;
import com.voice_agent_backend.dto.realtime.SessionUpdateEvent;
import com.voice_agent_backend.dto.realtime.SessionUpdateEvent.SessionConfig.TranscriptionConfig;
import com.voice_agent_backend.dto.realtime.SessionUpdateEvent.SessionConfig.TurnDetectionConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ConfigurationException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;
import com.voice_agent_backend.services.CredentialSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens one OpenAI Realtime WebSocket per session. There is no retry: a failed connect or
 * configuration fails the session.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OpenAiRealtimeSessionManager implements UpstreamSessionManager {

    private final RealtimeConfig realtimeConfig;
    private final CredentialSource credentialSource;
    private final WebSocketClient upstreamWebSocketClient;
    private final ObjectMapper objectMapper;

    @Override
    public UpstreamConnection connect(UpstreamSessionConfig config) {
        String sessionId = config.getSessionId();
        String apiKey = resolveApiKey(config);

        OpenAiRealtimeConnection connection = new OpenAiRealtimeConnection(sessionId, realtimeConfig, objectMapper);
        String wsUrl = realtimeConfig.getWebSocketUrl();
        log.info("Session {}: connecting to OpenAI Realtime API at {}", sessionId, wsUrl);

        CompletableFuture<WebSocketSession> handshake =
                upstreamWebSocketClient.execute(connection, createAuthHeaders(apiKey), URI.create(wsUrl));
        try {
            handshake.get(realtimeConfig.getConnectTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            handshake.cancel(false);
            connection.close();
            log.error("Session {}: upstream connect timed out after {}ms", sessionId, realtimeConfig.getConnectTimeoutMs());
            throw new UpstreamUnavailableException("upstream connect timed out", sessionId, e);
        } catch (ExecutionException e) {
            connection.close();
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Session {}: failed to connect to OpenAI Realtime API: {}", sessionId, cause.getMessage());
            throw new UpstreamUnavailableException("upstream connect failed: " + cause.getMessage(), sessionId, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handshake.cancel(false);
            connection.close();
            throw new UpstreamUnavailableException("interrupted while connecting upstream", sessionId, e);
        }

        try {
            connection.sendSessionUpdate(buildSessionUpdate(config));
            connection.awaitConfigured(realtimeConfig.getConfigureTimeoutMs());
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        log.info("Session {}: upstream session configured for agent {}", sessionId, config.getAgentId());
        return connection;
    }

    /**
     * The agent owner's key wins over the process-wide default.
     */
    String resolveApiKey(UpstreamSessionConfig config) {
        Optional<String> userKey = credentialSource.findApiKey(config.getUserId());
        if (userKey.isPresent()) {
            return userKey.get();
        }
        if (realtimeConfig.hasDefaultApiKey()) {
            return realtimeConfig.getApiKey();
        }
        log.error("Session {}: no OpenAI API key for user {} and no default configured",
                config.getSessionId(), config.getUserId());
        throw new ConfigurationException("OpenAI API key not configured", config.getSessionId());
    }

    SessionUpdateEvent buildSessionUpdate(UpstreamSessionConfig config) {
        SessionUpdateEvent.SessionConfig session = SessionUpdateEvent.SessionConfig.builder()
                .modalities(List.copyOf(realtimeConfig.getModalities()))
                .instructions(config.getInstructions())
                .voice(realtimeConfig.getVoice())
                .inputAudioFormat(realtimeConfig.getAudioFormat())
                .outputAudioFormat(realtimeConfig.getAudioFormat())
                .inputAudioTranscription(new TranscriptionConfig(realtimeConfig.getTranscriptionModel()))
                .turnDetection(new TurnDetectionConfig(
                        realtimeConfig.getVadType(),
                        realtimeConfig.getVadThreshold(),
                        realtimeConfig.getPrefixPaddingMs(),
                        realtimeConfig.getSilenceDurationMs()))
                .tools(config.getTools())
                .toolChoice(realtimeConfig.getToolChoice())
                .build();
        return new SessionUpdateEvent(session);
    }

    private WebSocketHttpHeaders createAuthHeaders(String apiKey) {
        WebSocketHttpHeaders headers = new WebSocketHttpHeaders();
        headers.add("Authorization", "Bearer " + apiKey);
        headers.add("OpenAI-Beta", "realtime=v1");
        headers.add("User-Agent", realtimeConfig.getUserAgent());
        return headers;
    }
}
