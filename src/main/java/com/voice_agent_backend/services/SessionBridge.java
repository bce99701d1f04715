package com.voice_agent_backend.services;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.DuplicateToolCallException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;
import com.voice_agent_backend.models.ClientFrame;
import com.voice_agent_backend.models.RealtimeSession;
import com.voice_agent_backend.models.TerminationCause;
import com.voice_agent_backend.models.UpstreamEvent;
import com.voice_agent_backend.services.realtime.UpstreamConnection;
import com.voice_agent_backend.services.realtime.UpstreamEventSequence;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.transport.ClientMessages;
import com.voice_agent_backend.services.transport.ClientTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the two pumps of an ACTIVE session until either side ends it.
 * <p>
 * The client pump forwards audio and control frames upstream. The upstream pump forwards every
 * event to the client; a completed function call is executed and its result submitted upstream
 * before that event is forwarded and before the next event is taken.
 */
@Service
@Slf4j
public class SessionBridge {

    private final ToolRegistry toolRegistry;
    private final SessionConfig sessionConfig;
    private final ClientMessages clientMessages;
    private final ObjectMapper objectMapper;
    private final TaskExecutor pumpExecutor;

    public SessionBridge(ToolRegistry toolRegistry,
                         SessionConfig sessionConfig,
                         ClientMessages clientMessages,
                         ObjectMapper objectMapper,
                         @Qualifier("realtimePumpExecutor") TaskExecutor pumpExecutor) {
        this.toolRegistry = toolRegistry;
        this.sessionConfig = sessionConfig;
        this.clientMessages = clientMessages;
        this.objectMapper = objectMapper;
        this.pumpExecutor = pumpExecutor;
    }

    /**
     * Block until the session terminates and both pumps have stopped or the drain grace expired.
     *
     * @return the first termination cause reported
     */
    public TerminationCause run(RealtimeSession session) {
        UpstreamEventSequence events = session.getUpstream().events();
        ToolCallInterceptor interceptor = new ToolCallInterceptor(session, toolRegistry);

        CompletableFuture<Void> clientPump;
        CompletableFuture<Void> upstreamPump;
        try {
            clientPump = CompletableFuture.runAsync(() -> pumpClientToUpstream(session), pumpExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Session {}: no pump thread available", session.getSessionId());
            session.terminate(TerminationCause.INTERNAL_ERROR);
            return session.getTerminationCause();
        }
        try {
            upstreamPump = CompletableFuture.runAsync(
                    () -> pumpUpstreamToClient(session, events, interceptor), pumpExecutor);
        } catch (RejectedExecutionException e) {
            log.error("Session {}: no pump thread available", session.getSessionId());
            session.terminate(TerminationCause.INTERNAL_ERROR);
            awaitDrain(session, clientPump);
            return session.getTerminationCause();
        }

        TerminationCause cause = session.getTermination().join();
        log.info("Session {}: draining after {}", session.getSessionId(), cause.getDescription());
        awaitDrain(session, CompletableFuture.allOf(clientPump, upstreamPump));
        if (interceptor.getOpenCallCount() > 0) {
            log.debug("Session {}: {} tool calls never acknowledged upstream",
                    session.getSessionId(), interceptor.getOpenCallCount());
        }
        return cause;
    }

    private void awaitDrain(RealtimeSession session, CompletableFuture<Void> pumps) {
        try {
            pumps.get(sessionConfig.getDrainGraceMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // The straggler exits at its next poll
            log.warn("Session {}: pumps still running after {}ms grace, abandoning",
                    session.getSessionId(), sessionConfig.getDrainGraceMs());
            pumps.cancel(false);
        } catch (ExecutionException e) {
            log.error("Session {}: pump failed", session.getSessionId(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pumps.cancel(false);
        }
    }

    void pumpClientToUpstream(RealtimeSession session) {
        String sessionId = session.getSessionId();
        ClientTransport client = session.getClientTransport();
        UpstreamConnection upstream = session.getUpstream();
        try {
            while (!session.isTerminating()) {
                ClientFrame frame = client.receive(sessionConfig.getPollIntervalMs(), TimeUnit.MILLISECONDS);
                if (frame == null) {
                    continue;
                }
                switch (frame.getKind()) {
                    case AUDIO -> {
                        upstream.sendAudio(frame.getAudio());
                        session.getAudioFramesForwarded().incrementAndGet();
                    }
                    case CONTROL -> {
                        if (!forwardControl(session, frame.getText())) {
                            session.terminate(TerminationCause.MALFORMED_CLIENT_FRAME);
                            return;
                        }
                    }
                    case DISCONNECT -> {
                        log.info("Session {}: client disconnected ({})", sessionId, frame.getText());
                        session.terminate(TerminationCause.CLIENT_DISCONNECT);
                        return;
                    }
                }
            }
        } catch (UpstreamUnavailableException e) {
            log.error("Session {}: upstream send failed: {}", sessionId, e.getMessage());
            session.terminate(TerminationCause.UPSTREAM_TRANSPORT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.terminate(TerminationCause.SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("Session {}: client pump failed", sessionId, e);
            session.terminate(TerminationCause.INTERNAL_ERROR);
        }
    }

    /**
     * @return false if the frame is not a JSON object with a type
     */
    private boolean forwardControl(RealtimeSession session, String text) {
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("Session {}: malformed client frame: {}", session.getSessionId(), e.getOriginalMessage());
            return false;
        }
        if (message == null || !message.isObject() || !message.path("type").isTextual()) {
            log.warn("Session {}: client frame is not a typed JSON object", session.getSessionId());
            return false;
        }

        String type = message.get("type").asText();
        if (sessionConfig.getForwardedClientEvents().contains(type)) {
            log.debug("Session {}: forwarding client {}", session.getSessionId(), type);
            session.getUpstream().sendClientEvent(text);
        } else {
            log.debug("Session {}: ignoring client message type {}", session.getSessionId(), type);
        }
        return true;
    }

    void pumpUpstreamToClient(RealtimeSession session, UpstreamEventSequence events, ToolCallInterceptor interceptor) {
        String sessionId = session.getSessionId();
        ClientTransport client = session.getClientTransport();
        try {
            while (!session.isTerminating()) {
                UpstreamEvent event = events.next(sessionConfig.getPollIntervalMs(), TimeUnit.MILLISECONDS);
                if (event == null) {
                    if (events.isExhausted()) {
                        session.terminate(TerminationCause.UPSTREAM_CLOSED);
                        return;
                    }
                    continue;
                }

                switch (event.getType()) {
                    case FUNCTION_CALL_ARGUMENTS_DONE -> interceptToolCall(session, interceptor, event);
                    case CONVERSATION_ITEM_CREATED -> interceptor.onItemCreated(event);
                    case ERROR -> log.warn("Session {}: upstream error event forwarded to client: {}",
                            sessionId, event.getErrorMessage());
                    default -> {
                    }
                }

                try {
                    client.send(clientMessages.forward(event));
                    session.getEventsForwarded().incrementAndGet();
                } catch (IOException e) {
                    if (client.isOpen()) {
                        log.error("Session {}: failed to forward {} to client: {}",
                                sessionId, event.getWireType(), e.getMessage());
                        session.terminate(TerminationCause.CLIENT_TRANSPORT_ERROR);
                    } else {
                        session.terminate(TerminationCause.CLIENT_DISCONNECT);
                    }
                    return;
                }
            }
        } catch (UpstreamUnavailableException e) {
            log.error("Session {}: could not submit tool result: {}", sessionId, e.getMessage());
            session.terminate(TerminationCause.UPSTREAM_TRANSPORT_ERROR);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.terminate(TerminationCause.SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("Session {}: upstream pump failed", sessionId, e);
            session.terminate(TerminationCause.INTERNAL_ERROR);
        }
    }

    private void interceptToolCall(RealtimeSession session, ToolCallInterceptor interceptor, UpstreamEvent event) {
        try {
            interceptor.onArgumentsDone(event);
        } catch (DuplicateToolCallException e) {
            log.warn("Session {}: ignoring repeated function call {} for tool {}",
                    session.getSessionId(), e.getCallId(), event.getFunctionName());
        }
    }
}
