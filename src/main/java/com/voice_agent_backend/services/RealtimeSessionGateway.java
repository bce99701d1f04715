package com.voice_agent_backend.services;

import com.voice_agent_backend.config.RealtimeConfig;
import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ConfigurationException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.RateLimitExceededException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.models.RealtimeSession;
import com.voice_agent_backend.models.SessionOutcome;
import com.voice_agent_backend.models.SessionState;
import com.voice_agent_backend.models.TerminationCause;
import com.voice_agent_backend.services.realtime.UpstreamConnection;
import com.voice_agent_backend.services.realtime.UpstreamSessionConfig;
import com.voice_agent_backend.services.realtime.UpstreamSessionManager;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.transport.ClientMessages;
import com.voice_agent_backend.services.transport.ClientTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Owns a realtime session from the accepted client socket to teardown: gating, upstream
 * configuration, the bridge run, and release of both ends on every path.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RealtimeSessionGateway {

    static final String AGENT_NOT_FOUND = "agent not found";
    static final String AGENT_NOT_ACTIVE = "agent not active";
    static final String TIER_NOT_ELIGIBLE = "tier not eligible";

    private final AgentConfigSource agentConfigSource;
    private final UpstreamSessionManager upstreamSessionManager;
    private final ToolRegistry toolRegistry;
    private final SessionBridge sessionBridge;
    private final RateLimitingService rateLimitingService;
    private final ActiveSessionRegistry activeSessionRegistry;
    private final ClientMessages clientMessages;
    private final RealtimeConfig realtimeConfig;
    private final SessionConfig sessionConfig;

    /**
     * Run one session to completion on the calling thread. Never throws; the outcome carries
     * the terminal state and, on failure, the reason sent to the client.
     */
    public SessionOutcome open(ClientTransport client, String agentId) {
        RealtimeSession session = new RealtimeSession(UUID.randomUUID().toString(), agentId, client);
        activeSessionRegistry.register(session);
        log.info("Session {}: opening for agent {} (client {})", session.getSessionId(), agentId, client.getId());

        try {
            if (agentId == null || agentId.isBlank()) {
                session.fail(AGENT_NOT_FOUND);
                return outcome(session);
            }
            rateLimitingService.checkSessionOpen(agentId);

            Optional<AgentSnapshot> found = agentConfigSource.findAgent(agentId);
            String rejection = checkEligibility(found);
            if (rejection != null) {
                log.warn("Session {}: rejected for agent {}: {}", session.getSessionId(), agentId, rejection);
                session.fail(rejection);
                return outcome(session);
            }
            AgentSnapshot agent = found.get();
            session.attachAgent(agent);

            session.transitionTo(SessionState.CONFIGURING);
            UpstreamConnection upstream = upstreamSessionManager.connect(buildUpstreamConfig(session, agent));
            session.attachUpstream(upstream);

            if (session.isTerminating()) {
                // Stopped while configuring
                session.fail(session.getTerminationCause().getDescription());
                return outcome(session);
            }
            session.transitionTo(SessionState.ACTIVE);

            if (!sendReady(session, agent)) {
                settle(session, session.getTerminationCause());
                return outcome(session);
            }

            TerminationCause cause = sessionBridge.run(session);
            settle(session, cause);

        } catch (RateLimitExceededException | ConfigurationException | UpstreamUnavailableException e) {
            log.warn("Session {}: failed to start: {}", session.getSessionId(), e.getMessage());
            session.fail(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Session {}: unexpected failure", session.getSessionId(), e);
            session.fail(TerminationCause.INTERNAL_ERROR.getDescription());
        } finally {
            teardown(session);
        }
        return outcome(session);
    }

    private String checkEligibility(Optional<AgentSnapshot> found) {
        if (found.isEmpty()) {
            return AGENT_NOT_FOUND;
        }
        AgentSnapshot agent = found.get();
        if (!agent.isActive()) {
            return AGENT_NOT_ACTIVE;
        }
        if (!sessionConfig.getEligibleTier().equalsIgnoreCase(agent.getPricingTier())) {
            return TIER_NOT_ELIGIBLE;
        }
        return null;
    }

    UpstreamSessionConfig buildUpstreamConfig(RealtimeSession session, AgentSnapshot agent) {
        return UpstreamSessionConfig.builder()
                .sessionId(session.getSessionId())
                .agentId(agent.getAgentId())
                .userId(agent.getUserId())
                .instructions(buildInstructions(agent))
                .tools(toolRegistry.getToolDefinitions(agent.getEnabledTools()))
                .build();
    }

    private String buildInstructions(AgentSnapshot agent) {
        String prompt = agent.getSystemPrompt();
        if (prompt == null || prompt.isBlank()) {
            prompt = realtimeConfig.getDefaultInstructions();
        }
        String language = agent.getLanguage();
        if (language == null || language.isBlank()) {
            return prompt;
        }
        return prompt + "\n\nSpeak with the caller in this language: " + language + ".";
    }

    private boolean sendReady(RealtimeSession session, AgentSnapshot agent) {
        ClientTransport client = session.getClientTransport();
        try {
            client.send(clientMessages.sessionReady(session.getSessionId(), agent));
            log.info("Session {}: ready for agent {} ({})", session.getSessionId(), agent.getAgentId(), agent.getName());
            return true;
        } catch (IOException e) {
            log.warn("Session {}: could not send ready frame: {}", session.getSessionId(), e.getMessage());
            session.terminate(client.isOpen()
                    ? TerminationCause.CLIENT_TRANSPORT_ERROR
                    : TerminationCause.CLIENT_DISCONNECT);
            return false;
        }
    }

    private void settle(RealtimeSession session, TerminationCause cause) {
        if (cause.isFailure()) {
            session.fail(cause.getDescription());
        } else {
            if (session.getState() == SessionState.ACTIVE) {
                session.transitionTo(SessionState.DRAINING);
            }
            session.transitionTo(SessionState.CLOSED);
        }
    }

    private void teardown(RealtimeSession session) {
        UpstreamConnection upstream = session.getUpstream();
        if (upstream != null) {
            upstream.close();
        }

        if (!session.getState().isTerminal()) {
            // Reached only if an unexpected path skipped settle()
            session.fail(TerminationCause.INTERNAL_ERROR.getDescription());
        }

        ClientTransport client = session.getClientTransport();
        boolean failed = session.getState() == SessionState.FAILED;
        if (failed) {
            try {
                client.send(clientMessages.error(session.getFailureReason()));
            } catch (IOException | RuntimeException e) {
                log.debug("Session {}: error frame not delivered: {}", session.getSessionId(), e.getMessage());
            }
        }
        client.close(failed);
        activeSessionRegistry.unregister(session);

        log.info("Session {}: ended in {}{} - audio frames: {}, events: {}, tool calls: {} ok / {} failed",
                session.getSessionId(), session.getState(),
                failed ? " (" + session.getFailureReason() + ")" : "",
                session.getAudioFramesForwarded().get(), session.getEventsForwarded().get(),
                session.getToolCallsCompleted().get(), session.getToolCallsFailed().get());
    }

    private SessionOutcome outcome(RealtimeSession session) {
        return SessionOutcome.builder()
                .sessionId(session.getSessionId())
                .agentId(session.getAgentId())
                .state(session.getState())
                .reason(session.getFailureReason())
                .cause(session.getTerminationCause())
                .build();
    }
}
