package com.voice_agent_backend.services.impl;

import com.voice_agent_backend.models.Agent;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.repositories.AgentRepository;
import com.voice_agent_backend.services.AgentConfigSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class JpaAgentConfigSource implements AgentConfigSource {

    private final AgentRepository agentRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<AgentSnapshot> findAgent(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return Optional.empty();
        }
        Optional<AgentSnapshot> snapshot = agentRepository.findById(agentId).map(this::toSnapshot);
        if (snapshot.isEmpty()) {
            log.debug("No agent with id {}", agentId);
        }
        return snapshot;
    }

    private AgentSnapshot toSnapshot(Agent agent) {
        return AgentSnapshot.builder()
                .agentId(agent.getId())
                .userId(agent.getUserId())
                .name(agent.getName())
                .systemPrompt(agent.getSystemPrompt())
                .enabledTools(agent.getEnabledTools() == null ? List.of() : List.copyOf(agent.getEnabledTools()))
                .language(agent.getLanguage())
                .pricingTier(agent.getPricingTier())
                .active(Boolean.TRUE.equals(agent.getIsActive()))
                .recordingEnabled(Boolean.TRUE.equals(agent.getEnableRecording()))
                .transcriptEnabled(Boolean.TRUE.equals(agent.getEnableTranscript()))
                .build();
    }
}
