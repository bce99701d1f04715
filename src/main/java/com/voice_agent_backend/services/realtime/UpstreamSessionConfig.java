package com.voice_agent_backend.services.realtime;

import com.voice_agent_backend.services.tools.ToolSchema;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything needed to open one upstream conversation, derived from the agent snapshot.
 */
@Value
@Builder
public class UpstreamSessionConfig {
    String sessionId;
    String agentId;
    String userId;
    String instructions;
    List<ToolSchema> tools;

    public List<ToolSchema> getTools() {
        return tools == null ? List.of() : tools;
    }
}
