package com.voice_agent_backend.controllers;

import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.models.ClientFrame;
import com.voice_agent_backend.models.SessionOutcome;
import com.voice_agent_backend.services.RealtimeSessionGateway;
import com.voice_agent_backend.services.transport.ClientMessages;
import com.voice_agent_backend.services.transport.WebSocketClientTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.net.URI;
import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;

/**
 * Server endpoint for realtime voice calls. Each accepted socket gets its own gateway run on
 * the session executor; this handler only moves frames into that session's transport.
 */
@Component
@Slf4j
public class RealtimeWebSocketHandler extends AbstractWebSocketHandler {

    public static final String PATH_PREFIX = "/ws/realtime/";

    private final RealtimeSessionGateway gateway;
    private final SessionConfig sessionConfig;
    private final ClientMessages clientMessages;
    private final TaskExecutor sessionExecutor;

    private final Map<String, WebSocketClientTransport> transports = new ConcurrentHashMap<>();

    public RealtimeWebSocketHandler(RealtimeSessionGateway gateway,
                                    SessionConfig sessionConfig,
                                    ClientMessages clientMessages,
                                    @Qualifier("realtimeSessionExecutor") TaskExecutor sessionExecutor) {
        this.gateway = gateway;
        this.sessionConfig = sessionConfig;
        this.clientMessages = clientMessages;
        this.sessionExecutor = sessionExecutor;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String agentId = extractAgentId(session.getUri());
        WebSocketClientTransport transport = new WebSocketClientTransport(
                session, sessionConfig.getClientQueueCapacity(), sessionConfig.getClientEnqueueTimeoutMs());
        transports.put(session.getId(), transport);
        log.info("Realtime client connected: {} for agent {}", session.getId(), agentId);

        try {
            sessionExecutor.execute(() -> runSession(transport, agentId));
        } catch (RejectedExecutionException e) {
            log.warn("Rejecting realtime client {}: no session capacity", session.getId());
            transports.remove(session.getId());
            try {
                transport.send(clientMessages.error("server at capacity"));
            } finally {
                transport.close(true);
            }
        }
    }

    private void runSession(WebSocketClientTransport transport, String agentId) {
        try {
            SessionOutcome outcome = gateway.open(transport, agentId);
            log.info("Realtime client {} finished: session {} {}", transport.getId(), outcome.getSessionId(),
                    outcome.isFailed() ? "failed (" + outcome.getReason() + ")" : "closed");
        } finally {
            transports.remove(transport.getId());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        WebSocketClientTransport transport = transports.get(session.getId());
        if (transport == null) {
            return;
        }
        ByteBuffer payload = message.getPayload();
        byte[] audio = new byte[payload.remaining()];
        payload.get(audio);
        transport.offer(ClientFrame.audio(audio));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketClientTransport transport = transports.get(session.getId());
        if (transport != null) {
            transport.offer(ClientFrame.control(message.getPayload()));
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Realtime client {} transport error: {}", session.getId(), exception.getMessage());
        WebSocketClientTransport transport = transports.get(session.getId());
        if (transport != null) {
            transport.markDisconnected("transport error: " + exception.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("Realtime client disconnected: {} - {}", session.getId(), status.getCode());
        WebSocketClientTransport transport = transports.get(session.getId());
        if (transport != null) {
            transport.markDisconnected("closed with code " + status.getCode());
        }
    }

    static String extractAgentId(URI uri) {
        if (uri == null) {
            return null;
        }
        String path = uri.getPath();
        int start = path.indexOf(PATH_PREFIX);
        if (start < 0) {
            return null;
        }
        String agentId = path.substring(start + PATH_PREFIX.length());
        int slash = agentId.indexOf('/');
        if (slash >= 0) {
            agentId = agentId.substring(0, slash);
        }
        return agentId.isBlank() ? null : agentId;
    }
}
