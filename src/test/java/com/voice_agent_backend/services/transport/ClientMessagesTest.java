package com.voice_agent_backend.services.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.support.JsonFrames;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ClientMessagesTest {

    private final ClientMessages clientMessages = new ClientMessages(JsonFrames.MAPPER);

    @Test
    void sessionEndingErrorCarriesReasonText() {
        JsonNode frame = JsonFrames.parse(clientMessages.error("upstream_unavailable"));

        assertThat(frame.path("type").asText()).isEqualTo(ClientMessages.ERROR);
        assertThat(frame.path("error").isTextual()).isTrue();
        assertThat(frame.path("error").asText()).isEqualTo("upstream_unavailable");
        assertThat(frame.has("event")).isFalse();
    }

    @Test
    void forwardedUpstreamErrorKeepsPayloadUnderEvent() {
        JsonNode frame = JsonFrames.parse(clientMessages.forward(JsonFrames.event(
                "{\"type\":\"error\",\"error\":{\"type\":\"invalid_request_error\",\"message\":\"bad audio\"}}")));

        assertThat(frame.path("type").asText()).isEqualTo("error");
        assertThat(frame.has("error")).isFalse();
        assertThat(frame.path("event").path("error").path("message").asText()).isEqualTo("bad audio");
    }

    @Test
    void sessionReadyDescribesAgent() {
        AgentSnapshot agent = AgentSnapshot.builder().agentId("agent-1").userId("user-1").name("Desk")
                .pricingTier("premium").build();

        JsonNode frame = JsonFrames.parse(clientMessages.sessionReady("s-1", agent));

        assertThat(frame.path("type").asText()).isEqualTo(ClientMessages.SESSION_READY);
        assertThat(frame.path("session_id").asText()).isEqualTo("s-1");
        assertThat(frame.path("agent").path("tier").asText()).isEqualTo("premium");
    }
}
