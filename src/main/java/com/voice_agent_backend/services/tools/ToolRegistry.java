package com.voice_agent_backend.services.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.InvalidToolArgumentsException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UnknownToolException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps tool names to handlers and runs them. Built once at startup and shared read-only
 * by every session; nothing thrown by a handler escapes {@link #executeTool}.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, ToolHandler> handlers;
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<ToolHandler> toolHandlers, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Map<String, ToolHandler> byName = new LinkedHashMap<>();
        for (ToolHandler handler : toolHandlers) {
            ToolHandler previous = byName.putIfAbsent(handler.getName(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool handler for name: " + handler.getName());
            }
        }
        this.handlers = Collections.unmodifiableMap(byName);
        log.info("Tool registry initialized with {} tools: {}", handlers.size(), handlers.keySet());
    }

    /**
     * Schemas for the requested tools, in request order without duplicates. Names with no
     * registered handler are skipped.
     */
    public List<ToolSchema> getToolDefinitions(Collection<String> enabledNames) {
        if (enabledNames == null || enabledNames.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>(enabledNames);
        List<ToolSchema> schemas = new ArrayList<>(seen.size());
        for (String name : seen) {
            ToolHandler handler = handlers.get(name);
            if (handler == null) {
                log.warn("Enabled tool '{}' has no registered handler, skipping", name);
                continue;
            }
            schemas.add(handler.getSchema());
        }
        return schemas;
    }

    public List<ToolSchema> getAllToolDefinitions() {
        return handlers.values().stream().map(ToolHandler::getSchema).toList();
    }

    public Optional<ToolHandler> getHandler(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    public boolean hasTool(String name) {
        return handlers.containsKey(name);
    }

    public ToolResult executeTool(String name, String rawArguments) {
        return executeTool(name, rawArguments, null);
    }

    /**
     * Execute with the argument string exactly as the model produced it.
     */
    public ToolResult executeTool(String name, String rawArguments, ToolContext context) {
        long startTime = System.currentTimeMillis();
        JsonNode arguments;
        try {
            arguments = parseArguments(rawArguments);
        } catch (InvalidToolArgumentsException e) {
            log.warn("Invalid arguments for tool {}: {}", name, e.getMessage());
            return ToolResult.failure(name, ToolErrorType.INVALID_ARGUMENTS, e.getMessage(),
                    System.currentTimeMillis() - startTime);
        }
        return executeTool(name, arguments, context);
    }

    public ToolResult executeTool(String name, JsonNode arguments, ToolContext context) {
        long startTime = System.currentTimeMillis();

        try {
            ToolHandler handler = getHandler(name).orElseThrow(() -> new UnknownToolException(name));
            JsonNode payload = arguments == null || arguments.isNull()
                    ? objectMapper.createObjectNode()
                    : arguments;
            validateArguments(handler.getSchema(), payload);

            log.debug("Executing tool: {} with args: {}", name, payload);
            Map<String, Object> data = handler.execute(payload, context);

            long duration = System.currentTimeMillis() - startTime;
            log.info("Tool {} completed in {}ms", name, duration);
            return ToolResult.success(name, data, duration);

        } catch (UnknownToolException e) {
            log.error("Tool not found: {}", name);
            return ToolResult.failure(name, ToolErrorType.UNKNOWN_TOOL, e.getMessage(),
                    System.currentTimeMillis() - startTime);

        } catch (InvalidToolArgumentsException e) {
            log.warn("Tool {} rejected arguments: {}", name, e.getMessage());
            return ToolResult.failure(name, ToolErrorType.INVALID_ARGUMENTS, e.getMessage(),
                    System.currentTimeMillis() - startTime);

        } catch (ToolExecutionException e) {
            log.error("Tool execution failed: {} - {}", name, e.getMessage(), e);
            return ToolResult.failure(name, ToolErrorType.EXECUTION_ERROR, e.getMessage(),
                    System.currentTimeMillis() - startTime);

        } catch (Exception e) {
            log.error("Tool execution failed: {} - {}", name, e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ToolResult.failure(name, ToolErrorType.EXECUTION_ERROR, message,
                    System.currentTimeMillis() - startTime);
        }
    }

    private JsonNode parseArguments(String rawArguments) {
        if (rawArguments == null || rawArguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(rawArguments);
        } catch (JsonProcessingException e) {
            throw new InvalidToolArgumentsException("Arguments are not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private void validateArguments(ToolSchema schema, JsonNode arguments) {
        if (!arguments.isObject()) {
            throw new InvalidToolArgumentsException("Arguments must be a JSON object");
        }
        for (String required : schema.getRequiredArguments()) {
            JsonNode value = arguments.get(required);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank())) {
                throw new InvalidToolArgumentsException("Missing required argument: " + required);
            }
        }
    }
}
