package com.voice_agent_backend.services;

import com.voice_agent_backend.models.AgentSnapshot;

import java.util.Optional;

/**
 * Read-only access to agent configuration.
 */
public interface AgentConfigSource {

    Optional<AgentSnapshot> findAgent(String agentId);
}
