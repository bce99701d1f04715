package com.voice_agent_backend.services.tools;

import lombok.Value;

/**
 * Per-call scope handed to tool handlers. Data-owning tools only see records of {@code userId}.
 */
@Value
public class ToolContext {
    String sessionId;
    String agentId;
    String userId;
    String callId;

    public static ToolContext forUser(String userId) {
        return new ToolContext(null, null, userId, null);
    }
}
