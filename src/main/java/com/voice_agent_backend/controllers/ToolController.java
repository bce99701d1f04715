package com.voice_agent_backend.controllers;

import com.voice_agent_backend.dto.ToolExecuteRequest;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.NotFoundException;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.services.AgentConfigSource;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.tools.ToolResult;
import com.voice_agent_backend.services.tools.ToolSchema;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Tool catalogue and direct execution, for clients that talk to the model themselves and
 * relay function calls here.
 */
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
@Slf4j
public class ToolController {

    private final ToolRegistry toolRegistry;
    private final AgentConfigSource agentConfigSource;

    @GetMapping
    public List<ToolSchema> listTools() {
        return toolRegistry.getAllToolDefinitions();
    }

    /**
     * Execute a tool on behalf of an agent's owner. Tool failures are returned as a
     * failure-shaped result with status 200.
     */
    @PostMapping("/execute")
    public ResponseEntity<ToolResult> executeTool(@Valid @RequestBody ToolExecuteRequest request) {
        AgentSnapshot agent = agentConfigSource.findAgent(request.getAgentId())
                .orElseThrow(() -> new NotFoundException("Agent not found: " + request.getAgentId()));

        log.info("Tool execution requested: {} for agent {}", request.getToolName(), agent.getAgentId());
        ToolContext context = new ToolContext(null, agent.getAgentId(), agent.getUserId(), null);
        ToolResult result = toolRegistry.executeTool(request.getToolName(), request.getArguments(), context);

        log.info("Tool execution completed: {} success={}", request.getToolName(), result.isSuccess());
        return ResponseEntity.ok(result);
    }
}
