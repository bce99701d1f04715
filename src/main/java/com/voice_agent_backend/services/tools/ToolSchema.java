package com.voice_agent_backend.services.tools;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Function definition as advertised to the realtime model in {@code session.update}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ToolSchema {

    @Builder.Default
    private String type = "function";
    private String name;
    private String description;
    private Map<String, Object> parameters;

    @JsonIgnore
    @SuppressWarnings("unchecked")
    public List<String> getRequiredArguments() {
        if (parameters == null) {
            return List.of();
        }
        Object required = parameters.get("required");
        return required instanceof List<?> ? (List<String>) required : List.of();
    }
}
