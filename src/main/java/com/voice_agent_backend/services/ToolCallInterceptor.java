package com.voice_agent_backend.services;

import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.DuplicateToolCallException;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.models.RealtimeSession;
import com.voice_agent_backend.models.ToolCall;
import com.voice_agent_backend.models.UpstreamEvent;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the function calls requested by the model for one session and hands the results
 * back upstream.
 * <p>
 * A call stays in the ledger from argument completion until the service echoes its output
 * item back, so a repeated call id in that window is rejected rather than executed twice.
 */
@Slf4j
public class ToolCallInterceptor {

    private final RealtimeSession session;
    private final ToolRegistry toolRegistry;
    private final Map<String, ToolCall> ledger = new ConcurrentHashMap<>();

    public ToolCallInterceptor(RealtimeSession session, ToolRegistry toolRegistry) {
        this.session = session;
        this.toolRegistry = toolRegistry;
    }

    /**
     * Execute the call and submit its result. Returns once the result has been written upstream.
     *
     * @throws DuplicateToolCallException if the call id is still open
     */
    public ToolCall onArgumentsDone(UpstreamEvent event) {
        String callId = event.getCallId();
        String toolName = event.getFunctionName();
        if (callId == null || toolName == null) {
            log.warn("Session {}: function call event without call_id or name, ignoring", session.getSessionId());
            return null;
        }

        ToolCall call = new ToolCall(callId, toolName, event.getArguments());
        if (ledger.putIfAbsent(callId, call) != null) {
            throw new DuplicateToolCallException(callId);
        }

        call.markExecuting();
        log.info("Session {}: executing tool {} for call {}", session.getSessionId(), toolName, callId);
        ToolResult result = toolRegistry.executeTool(toolName, call.getArguments(), contextFor(callId));
        call.complete(result);
        if (result.isSuccess()) {
            session.getToolCallsCompleted().incrementAndGet();
        } else {
            session.getToolCallsFailed().incrementAndGet();
            log.warn("Session {}: tool {} failed for call {}: {} ({})", session.getSessionId(), toolName, callId,
                    result.getError(), result.getErrorType());
        }

        session.getUpstream().sendToolResult(callId, result);
        call.markSubmitted();
        log.debug("Session {}: submitted result for call {} in {}ms", session.getSessionId(), callId,
                result.getDurationMs());
        return call;
    }

    /**
     * Close the ledger entry once the service has accepted the output item.
     */
    public void onItemCreated(UpstreamEvent event) {
        String callId = event.getFunctionCallOutputId();
        if (callId != null && ledger.remove(callId) != null) {
            log.debug("Session {}: call {} acknowledged upstream", session.getSessionId(), callId);
        }
    }

    public int getOpenCallCount() {
        return ledger.size();
    }

    private ToolContext contextFor(String callId) {
        AgentSnapshot agent = session.getAgent();
        return new ToolContext(session.getSessionId(), session.getAgentId(),
                agent != null ? agent.getUserId() : null, callId);
    }
}
