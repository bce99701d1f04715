package com.voice_agent_backend.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.config.RealtimeConfig;
import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.RateLimitExceededException;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.models.SessionOutcome;
import com.voice_agent_backend.models.SessionState;
import com.voice_agent_backend.models.TerminationCause;
import com.voice_agent_backend.services.realtime.OpenAiRealtimeSessionManager;
import com.voice_agent_backend.services.realtime.UpstreamSessionConfig;
import com.voice_agent_backend.services.realtime.UpstreamSessionManager;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.transport.ClientMessages;
import com.voice_agent_backend.support.FakeClientTransport;
import com.voice_agent_backend.support.FakeUpstreamConnection;
import com.voice_agent_backend.support.FakeUpstreamSessionManager;
import com.voice_agent_backend.support.JsonFrames;
import com.voice_agent_backend.support.StubToolHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.client.WebSocketClient;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RealtimeSessionGatewayTest {

    @Mock
    private AgentConfigSource agentConfigSource;

    @Mock
    private RateLimitingService rateLimitingService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RealtimeConfig realtimeConfig;
    private SessionConfig sessionConfig;
    private ToolRegistry toolRegistry;
    private ActiveSessionRegistry activeSessionRegistry;
    private FakeClientTransport client;

    @BeforeEach
    void setUp() {
        realtimeConfig = new RealtimeConfig();
        sessionConfig = new SessionConfig();
        sessionConfig.setPollIntervalMs(20);
        sessionConfig.setDrainGraceMs(1000);
        toolRegistry = new ToolRegistry(List.of(
                StubToolHandler.returning("lookup_contact", Map.of("found", false)),
                StubToolHandler.returning("book_appointment", Map.of("booked", true))), objectMapper);
        activeSessionRegistry = new ActiveSessionRegistry();
        client = new FakeClientTransport();
    }

    private RealtimeSessionGateway gateway(UpstreamSessionManager upstreamSessionManager) {
        ClientMessages clientMessages = new ClientMessages(objectMapper);
        SessionBridge bridge = new SessionBridge(toolRegistry, sessionConfig, clientMessages, objectMapper,
                new SimpleAsyncTaskExecutor("test-pump-"));
        return new RealtimeSessionGateway(agentConfigSource, upstreamSessionManager, toolRegistry, bridge,
                rateLimitingService, activeSessionRegistry, clientMessages, realtimeConfig, sessionConfig);
    }

    private static AgentSnapshot agent(String tier, boolean active) {
        return AgentSnapshot.builder()
                .agentId("agent-1")
                .userId("user-1")
                .name("Front Desk")
                .systemPrompt("You answer the phone for a dental clinic.")
                .enabledTools(List.of("book_appointment", "lookup_contact", "unknown_tool"))
                .language("es-ES")
                .pricingTier(tier)
                .active(active)
                .build();
    }

    private void assertSingleErrorFrame(String reason) {
        assertThat(client.sentOfType("error")).singleElement()
                .satisfies(json -> assertThat(JsonFrames.parse(json).path("error").asText()).isEqualTo(reason));
        assertThat(client.getCloseCount()).isEqualTo(1);
    }

    @Test
    void standardTierIsRejectedWithoutConnecting() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("standard", true)));
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(new FakeUpstreamConnection());

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getState()).isEqualTo(SessionState.FAILED);
        assertThat(outcome.getReason()).isEqualTo("tier not eligible");
        assertThat(upstreamManager.getConnectCalls()).isEmpty();
        assertSingleErrorFrame("tier not eligible");
        assertThat(activeSessionRegistry.getActiveCount()).isZero();
    }

    @Test
    void unknownAgentIsRejectedWithoutConnecting() {
        when(agentConfigSource.findAgent("missing")).thenReturn(Optional.empty());
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(new FakeUpstreamConnection());

        SessionOutcome outcome = gateway(upstreamManager).open(client, "missing");

        assertThat(outcome.getReason()).isEqualTo("agent not found");
        assertThat(upstreamManager.getConnectCalls()).isEmpty();
        assertSingleErrorFrame("agent not found");
    }

    @Test
    void inactiveAgentIsRejectedWithoutConnecting() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", false)));
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(new FakeUpstreamConnection());

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getReason()).isEqualTo("agent not active");
        assertThat(upstreamManager.getConnectCalls()).isEmpty();
        assertSingleErrorFrame("agent not active");
    }

    @Test
    void rateLimitedOpenFailsBeforeAgentLookup() {
        doThrow(new RateLimitExceededException("rate limit exceeded", 60))
                .when(rateLimitingService).checkSessionOpen("agent-1");
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(new FakeUpstreamConnection());

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getReason()).isEqualTo("rate limit exceeded");
        verify(agentConfigSource, never()).findAgent(any());
        assertThat(upstreamManager.getConnectCalls()).isEmpty();
        assertSingleErrorFrame("rate limit exceeded");
    }

    @Test
    void upstreamConnectTimeoutFailsWithOneErrorFrameAndOneClose() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        realtimeConfig.setApiKey("sk-default");
        realtimeConfig.setConnectTimeoutMs(100);
        WebSocketClient webSocketClient = mock(WebSocketClient.class);
        when(webSocketClient.execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class)))
                .thenReturn(new CompletableFuture<>());
        CredentialSource credentials = userId -> Optional.empty();
        OpenAiRealtimeSessionManager upstreamManager =
                new OpenAiRealtimeSessionManager(realtimeConfig, credentials, webSocketClient, objectMapper);

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getState()).isEqualTo(SessionState.FAILED);
        assertThat(outcome.getReason()).isEqualTo("upstream connect timed out");
        assertThat(client.getSent()).hasSize(1);
        assertSingleErrorFrame("upstream connect timed out");
    }

    @Test
    void missingCredentialsFailAsConfigurationError() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        WebSocketClient webSocketClient = mock(WebSocketClient.class);
        CredentialSource credentials = userId -> Optional.empty();
        OpenAiRealtimeSessionManager upstreamManager =
                new OpenAiRealtimeSessionManager(realtimeConfig, credentials, webSocketClient, objectMapper);

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getReason()).isEqualTo("OpenAI API key not configured");
        assertSingleErrorFrame("OpenAI API key not configured");
        verify(webSocketClient, never()).execute(any(WebSocketHandler.class), any(WebSocketHttpHeaders.class), any(URI.class));
    }

    @Test
    void clientHangUpClosesCleanly() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        FakeUpstreamConnection upstream = new FakeUpstreamConnection();
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(upstream);
        client.pushAudio(new byte[]{1, 2, 3, 4});
        client.disconnect();

        SessionOutcome outcome = gateway(upstreamManager).open(client, "agent-1");

        assertThat(outcome.getState()).isEqualTo(SessionState.CLOSED);
        assertThat(outcome.isFailed()).isFalse();
        assertThat(outcome.getCause()).isEqualTo(TerminationCause.CLIENT_DISCONNECT);
        assertThat(upstream.getAudio()).hasSize(1);
        assertThat(upstream.getCloseCount()).isEqualTo(1);
        assertThat(client.getCloseCount()).isEqualTo(1);
        assertThat(client.sentOfType("error")).isEmpty();
    }

    @Test
    void readyFrameIsSentFirstAndNamesTheAgent() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        FakeUpstreamConnection upstream = new FakeUpstreamConnection();
        upstream.emit(JsonFrames.audioDelta("AAAA"));
        upstream.end();

        SessionOutcome outcome = gateway(FakeUpstreamSessionManager.returning(upstream)).open(client, "agent-1");

        JsonNode ready = JsonFrames.parse(client.getSent().get(0));
        assertThat(ready.path("type").asText()).isEqualTo("session.ready");
        assertThat(ready.path("session_id").asText()).isEqualTo(outcome.getSessionId());
        assertThat(ready.path("agent").path("id").asText()).isEqualTo("agent-1");
        assertThat(ready.path("agent").path("name").asText()).isEqualTo("Front Desk");
        assertThat(ready.path("agent").path("tier").asText()).isEqualTo("premium");
        assertThat(JsonFrames.type(client.getSent().get(1))).isEqualTo("response.audio.delta");
    }

    @Test
    void droppedUpstreamFailsTheSession() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        FakeUpstreamConnection upstream = new FakeUpstreamConnection();
        upstream.end();

        SessionOutcome outcome = gateway(FakeUpstreamSessionManager.returning(upstream)).open(client, "agent-1");

        assertThat(outcome.getState()).isEqualTo(SessionState.FAILED);
        assertThat(outcome.getReason()).isEqualTo("upstream connection closed");
        assertSingleErrorFrame("upstream connection closed");
    }

    @Test
    void upstreamConfigCarriesAgentPromptLanguageAndEnabledTools() {
        when(agentConfigSource.findAgent("agent-1")).thenReturn(Optional.of(agent("premium", true)));
        FakeUpstreamConnection upstream = new FakeUpstreamConnection();
        upstream.end();
        FakeUpstreamSessionManager upstreamManager = FakeUpstreamSessionManager.returning(upstream);

        gateway(upstreamManager).open(client, "agent-1");

        UpstreamSessionConfig config = upstreamManager.getConnectCalls().get(0);
        assertThat(config.getUserId()).isEqualTo("user-1");
        assertThat(config.getInstructions())
                .startsWith("You answer the phone for a dental clinic.")
                .contains("es-ES");
        assertThat(config.getTools()).extracting("name").containsExactly("book_appointment", "lookup_contact");
    }
}
