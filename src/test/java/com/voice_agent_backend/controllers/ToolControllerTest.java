package com.voice_agent_backend.controllers;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.services.AgentConfigSource;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.support.StubToolHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ToolControllerTest {

    @Mock
    private AgentConfigSource agentConfigSource;

    private StubToolHandler lookup;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        lookup = new StubToolHandler("lookup_contact", List.of("phone"), args -> Map.of("found", false));
        ToolRegistry registry = new ToolRegistry(List.of(lookup), new ObjectMapper());
        mockMvc = MockMvcBuilders.standaloneSetup(new ToolController(registry, agentConfigSource))
                .setControllerAdvice(new VoiceAgentExceptionHandler())
                .build();
    }

    private static AgentSnapshot agent() {
        return AgentSnapshot.builder().agentId("agent-1").userId("user-1").name("Desk")
                .pricingTier("premium").active(true).build();
    }

    @Test
    void listsRegisteredTools() throws Exception {
        mockMvc.perform(get("/api/v1/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].type").value("function"))
                .andExpect(jsonPath("$[0].name").value("lookup_contact"))
                .andExpect(jsonPath("$[0].parameters.required[0]").value("phone"));
    }

    @Test
    void executesOnBehalfOfTheAgentOwner() throws Exception {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent()));

        mockMvc.perform(post("/api/v1/tools/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"lookup_contact\",\"agent_id\":\"agent-1\",\"arguments\":{\"phone\":\"+15551234567\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.found").value(false));

        ToolContext context = lookup.getReceivedContexts().get(0);
        assertThat(context.getUserId()).isEqualTo("user-1");
        assertThat(context.getAgentId()).isEqualTo("agent-1");
        assertThat(lookup.getReceivedArguments().get(0).path("phone").asText()).isEqualTo("+15551234567");
    }

    @Test
    void toolFailureIsReportedInTheResultBody() throws Exception {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent()));

        mockMvc.perform(post("/api/v1/tools/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"lookup_contact\",\"agent_id\":\"agent-1\",\"arguments\":{}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_type").value("INVALID_ARGUMENTS"))
                .andExpect(jsonPath("$.error").value("Missing required argument: phone"));
        assertThat(lookup.getReceivedArguments()).isEmpty();
    }

    @Test
    void unknownToolIsAFailureResult() throws Exception {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent()));

        mockMvc.perform(post("/api/v1/tools/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"send_fax\",\"agent_id\":\"agent-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error_type").value("UNKNOWN_TOOL"));
    }

    @Test
    void unknownAgentIsNotFound() throws Exception {
        when(agentConfigSource.findAgent("ghost")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/tools/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tool_name\":\"lookup_contact\",\"agent_id\":\"ghost\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.type").value("NOT_FOUND"));
    }

    @Test
    void missingToolNameFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/tools/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_id\":\"agent-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fields.toolName").value("tool_name is required"));
    }
}
