package com.voice_agent_backend.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Agent configuration captured once when a session starts. Changes to the agent
 * only apply to sessions opened afterwards.
 */
@Value
@Builder
public class AgentSnapshot {
    String agentId;
    String userId;
    String name;
    String systemPrompt;
    List<String> enabledTools;
    String language;
    String pricingTier;
    boolean active;
    boolean recordingEnabled;
    boolean transcriptEnabled;

    public List<String> getEnabledTools() {
        return enabledTools == null ? List.of() : enabledTools;
    }
}
