package com.voice_agent_backend.services.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Outcome of one tool execution. {@code success} and {@code error} are authoritative;
 * this is what the model receives as the function call output.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolResult {

    private boolean success;
    private Map<String, Object> data;
    private String error;

    @JsonProperty("error_type")
    private ToolErrorType errorType;

    @JsonIgnore
    private String toolName;

    @JsonIgnore
    private long durationMs;

    public static ToolResult success(String toolName, Map<String, Object> data, long durationMs) {
        return ToolResult.builder()
                .success(true)
                .toolName(toolName)
                .data(data)
                .durationMs(durationMs)
                .build();
    }

    public static ToolResult failure(String toolName, ToolErrorType errorType, String error, long durationMs) {
        return ToolResult.builder()
                .success(false)
                .toolName(toolName)
                .errorType(errorType)
                .error(error == null || error.isBlank() ? errorType.name().toLowerCase() : error)
                .durationMs(durationMs)
                .build();
    }
}
