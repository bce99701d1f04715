package com.voice_agent_backend.services.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * A locally executed function the realtime model may call.
 * <p>
 * Implementations throw {@code InvalidToolArgumentsException} when the payload is unusable and
 * {@code ToolExecutionException} when a collaborator fails; the registry turns both into results.
 */
public interface ToolHandler {

    ToolSchema getSchema();

    Map<String, Object> execute(JsonNode arguments, ToolContext context);

    default String getName() {
        return getSchema().getName();
    }
}
