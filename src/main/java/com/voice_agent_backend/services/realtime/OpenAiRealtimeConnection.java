package com.voice_agent_backend.services.realtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.config.RealtimeConfig;
import com.voice_agent_backend.dto.realtime.AudioBufferAppendEvent;
import com.voice_agent_backend.dto.realtime.ConversationItemCreateEvent;
import com.voice_agent_backend.dto.realtime.ResponseCreateEvent;
import com.voice_agent_backend.dto.realtime.SessionUpdateEvent;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;
import com.voice_agent_backend.models.UpstreamEvent;
import com.voice_agent_backend.models.UpstreamEventType;
import com.voice_agent_backend.services.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One WebSocket to the realtime model service, owned by a single session.
 * <p>
 * Received events are buffered in a bounded queue for the session's upstream pump. Outbound
 * messages go through a {@link ConcurrentWebSocketSessionDecorator}, so audio from the client
 * pump and tool results from the upstream pump can be sent concurrently.
 */
@Slf4j
public class OpenAiRealtimeConnection implements WebSocketHandler, UpstreamConnection {

    private final String sessionId;
    private final RealtimeConfig realtimeConfig;
    private final ObjectMapper objectMapper;

    private final BlockingQueue<UpstreamEvent> inbound;
    private final CountDownLatch configured = new CountDownLatch(1);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicBoolean eventsTaken = new AtomicBoolean(false);

    private volatile WebSocketSession webSocketSession;
    private volatile boolean ended;
    private volatile boolean sessionUpdated;
    private volatile String configurationError;

    public OpenAiRealtimeConnection(String sessionId, RealtimeConfig realtimeConfig, ObjectMapper objectMapper) {
        this.sessionId = sessionId;
        this.realtimeConfig = realtimeConfig;
        this.objectMapper = objectMapper;
        this.inbound = new LinkedBlockingQueue<>(realtimeConfig.getEventQueueCapacity());
    }

    @Override
    public String getId() {
        WebSocketSession session = webSocketSession;
        return session != null ? session.getId() : null;
    }

    // WebSocketHandler

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        if (closed.get()) {
            // Connect deadline already passed; nobody is waiting for this socket
            log.warn("Session {}: upstream connected after it was abandoned, closing", sessionId);
            session.close(CloseStatus.GOING_AWAY);
            return;
        }
        this.webSocketSession = new ConcurrentWebSocketSessionDecorator(
                session, realtimeConfig.getSendTimeLimitMs(), realtimeConfig.getSendBufferSizeLimit());
        log.info("Session {}: connected to OpenAI Realtime API - upstream id: {}", sessionId, session.getId());
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        String payload;
        if (message instanceof TextMessage textMessage) {
            payload = textMessage.getPayload();
        } else if (message instanceof BinaryMessage binaryMessage) {
            payload = StandardCharsets.UTF_8.decode(binaryMessage.getPayload()).toString();
        } else {
            log.debug("Session {}: ignoring {} from upstream", sessionId, message.getClass().getSimpleName());
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Session {}: received non-JSON message, skipping: {}",
                    sessionId, payload.substring(0, Math.min(payload.length(), 100)));
            return;
        }
        if (node == null || !node.isObject()) {
            log.warn("Session {}: received JSON that is not an event object, skipping", sessionId);
            return;
        }

        UpstreamEvent event = UpstreamEvent.of(node);
        log.debug("Session {}: received OpenAI event: {}", sessionId, event.getWireType());
        trackConfiguration(event);
        enqueue(event);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Session {}: OpenAI WebSocket transport error: {}", sessionId, exception.getMessage());
        log.debug("Full transport error:", exception);
        close(CloseStatus.SERVER_ERROR);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        ended = true;
        configured.countDown();

        switch (closeStatus.getCode()) {
            case 1000 -> log.info("Session {}: upstream connection closed normally", sessionId);
            case 1001 -> log.info("Session {}: upstream connection closed - going away", sessionId);
            case 1006 -> log.warn("Session {}: upstream connection closed abnormally", sessionId);
            case 1011 -> log.error("Session {}: server error caused upstream close", sessionId);
            case 4000, 4001, 4002 -> log.error("Session {}: OpenAI API error ({}): {}",
                    sessionId, closeStatus.getCode(), closeStatus.getReason());
            default -> log.warn("Session {}: unexpected upstream close code: {} - {}",
                    sessionId, closeStatus.getCode(), closeStatus.getReason());
        }
    }

    @Override
    public boolean supportsPartialMessages() {
        return false;
    }

    // Configuration handshake

    void sendSessionUpdate(SessionUpdateEvent sessionUpdate) {
        sendJson(sessionUpdate);
        log.info("Session {}: session configuration sent ({} tools)", sessionId,
                sessionUpdate.getSession().getTools() == null ? 0 : sessionUpdate.getSession().getTools().size());
    }

    /**
     * Block until the service acknowledges the session configuration.
     *
     * @throws UpstreamUnavailableException on an upstream error, a closed connection or timeout
     */
    void awaitConfigured(long timeoutMs) {
        boolean signalled;
        try {
            signalled = configured.await(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException("interrupted while configuring upstream session", sessionId, e);
        }
        if (!signalled) {
            throw new UpstreamUnavailableException("upstream configuration timed out", sessionId);
        }
        if (configurationError != null) {
            throw new UpstreamUnavailableException("upstream rejected configuration: " + configurationError, sessionId);
        }
        if (!sessionUpdated) {
            throw new UpstreamUnavailableException("upstream closed during configuration", sessionId);
        }
    }

    private void trackConfiguration(UpstreamEvent event) {
        if (configured.getCount() == 0) {
            if (event.getType() == UpstreamEventType.ERROR) {
                log.error("Session {}: OpenAI API error - Type: {}, Message: {}",
                        sessionId, event.getErrorType(), event.getErrorMessage());
            }
            return;
        }
        if (event.getType() == UpstreamEventType.SESSION_UPDATED) {
            sessionUpdated = true;
            log.info("Session {}: OpenAI session updated successfully", sessionId);
            configured.countDown();
        } else if (event.getType() == UpstreamEventType.ERROR) {
            configurationError = event.getErrorMessage();
            log.error("Session {}: OpenAI rejected session configuration - Type: {}, Message: {}",
                    sessionId, event.getErrorType(), event.getErrorMessage());
            configured.countDown();
        }
    }

    private void enqueue(UpstreamEvent event) {
        try {
            if (!inbound.offer(event, realtimeConfig.getEventEnqueueTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.error("Session {}: upstream event queue full ({} events), consumer stalled; closing",
                        sessionId, inbound.size());
                close(CloseStatus.SERVER_ERROR);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Session {}: interrupted while buffering {}", sessionId, event.getWireType());
        }
    }

    // UpstreamConnection

    @Override
    public UpstreamEventSequence events() {
        if (!eventsTaken.compareAndSet(false, true)) {
            throw new IllegalStateException("Upstream events already consumed for session " + sessionId);
        }
        return new QueueEventSequence();
    }

    @Override
    public void sendAudio(byte[] pcm) {
        sendJson(new AudioBufferAppendEvent(Base64.getEncoder().encodeToString(pcm)));
    }

    @Override
    public void sendToolResult(String callId, ToolResult result) {
        String output;
        try {
            output = objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("could not encode tool result for call " + callId, sessionId, e);
        }
        sendJson(ConversationItemCreateEvent.functionCallOutput(callId, output));
        if (realtimeConfig.isAutoRespondAfterToolResult()) {
            sendJson(new ResponseCreateEvent());
        }
    }

    @Override
    public void sendClientEvent(String json) {
        sendText(json);
    }

    @Override
    public boolean isOpen() {
        WebSocketSession session = webSocketSession;
        return !closed.get() && !ended && session != null && session.isOpen();
    }

    @Override
    public void close() {
        close(CloseStatus.NORMAL);
    }

    private void close(CloseStatus status) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ended = true;
        configured.countDown();
        WebSocketSession session = webSocketSession;
        if (session != null && session.isOpen()) {
            try {
                session.close(status);
            } catch (IOException e) {
                log.warn("Session {}: error closing OpenAI session", sessionId, e);
            }
        }
    }

    private void sendJson(Object event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new UpstreamUnavailableException("could not encode upstream message", sessionId, e);
        }
        sendText(json);
    }

    private void sendText(String json) {
        WebSocketSession session = webSocketSession;
        if (!isOpen()) {
            throw new UpstreamUnavailableException("upstream connection closed", sessionId);
        }
        try {
            session.sendMessage(new TextMessage(json));
            if (log.isTraceEnabled()) {
                log.trace("Session {}: sent to OpenAI: {}", sessionId, json.substring(0, Math.min(json.length(), 100)));
            }
        } catch (IOException | RuntimeException e) {
            throw new UpstreamUnavailableException("upstream send failed: " + e.getMessage(), sessionId, e);
        }
    }

    private class QueueEventSequence implements UpstreamEventSequence {

        @Override
        public UpstreamEvent next(long timeout, TimeUnit unit) throws InterruptedException {
            if (isExhausted()) {
                return null;
            }
            return inbound.poll(timeout, unit);
        }

        @Override
        public boolean isExhausted() {
            return ended && inbound.isEmpty();
        }
    }
}
