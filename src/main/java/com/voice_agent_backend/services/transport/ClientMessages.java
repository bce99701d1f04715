package com.voice_agent_backend.services.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.models.UpstreamEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JSON frames sent to the calling party.
 * <p>
 * Two frames share the type {@code "error"}. The session-ending frame from {@link #error(String)}
 * carries a string {@code error} field and is always followed by the transport closing. An upstream
 * {@code error} event passed through {@link #forward(UpstreamEvent)} carries the upstream payload in
 * an {@code event} object and the session keeps running. Clients should branch on which field is present.
 */
@Component
@RequiredArgsConstructor
public class ClientMessages {

    public static final String SESSION_READY = "session.ready";
    public static final String ERROR = "error";

    private final ObjectMapper objectMapper;

    public String sessionReady(String sessionId, AgentSnapshot agent) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", SESSION_READY);
        frame.put("session_id", sessionId);
        ObjectNode agentNode = frame.putObject("agent");
        agentNode.put("id", agent.getAgentId());
        agentNode.put("name", agent.getName());
        agentNode.put("tier", agent.getPricingTier());
        return write(frame);
    }

    /**
     * The single frame sent before a failed session's transport closes.
     */
    public String error(String reason) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", ERROR);
        frame.put("error", reason);
        return write(frame);
    }

    /**
     * Upstream events reach the client unchanged, wrapped with their wire type.
     */
    public String forward(UpstreamEvent event) {
        ObjectNode frame = objectMapper.createObjectNode();
        frame.put("type", event.getWireType());
        frame.set("event", event.getPayload());
        return write(frame);
    }

    private String write(ObjectNode frame) {
        try {
            return objectMapper.writeValueAsString(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode client frame " + frame.path("type").asText(), e);
        }
    }
}
