package com.voice_agent_backend.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolExecuteRequest {

    @NotBlank(message = "tool_name is required")
    @JsonProperty("tool_name")
    private String toolName;

    private JsonNode arguments;

    @NotBlank(message = "agent_id is required")
    @JsonProperty("agent_id")
    private String agentId;
}
