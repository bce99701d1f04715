package com.voice_agent_backend.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.voice_agent_backend.config.SessionConfig;
import com.voice_agent_backend.models.AgentSnapshot;
import com.voice_agent_backend.models.RealtimeSession;
import com.voice_agent_backend.models.SessionState;
import com.voice_agent_backend.models.TerminationCause;
import com.voice_agent_backend.services.tools.ToolErrorType;
import com.voice_agent_backend.services.tools.ToolRegistry;
import com.voice_agent_backend.services.tools.ToolResult;
import com.voice_agent_backend.services.transport.ClientMessages;
import com.voice_agent_backend.support.Await;
import com.voice_agent_backend.support.FakeClientTransport;
import com.voice_agent_backend.support.FakeUpstreamConnection;
import com.voice_agent_backend.support.JsonFrames;
import com.voice_agent_backend.support.StubToolHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static com.voice_agent_backend.support.JsonFrames.audioDelta;
import static com.voice_agent_backend.support.JsonFrames.functionCallDone;
import static org.assertj.core.api.Assertions.assertThat;

class SessionBridgeTest {

    private static final String LOOKUP_ARGS = "{\"phone\":\"+15551234567\"}";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private List<String> journal;
    private FakeClientTransport client;
    private FakeUpstreamConnection upstream;
    private StubToolHandler lookupContact;
    private StubToolHandler failingTool;
    private RealtimeSession session;
    private SessionBridge bridge;

    @BeforeEach
    void setUp() {
        journal = new CopyOnWriteArrayList<>();
        client = new FakeClientTransport(journal);
        upstream = new FakeUpstreamConnection(journal);

        lookupContact = new StubToolHandler("lookup_contact", List.of("phone"),
                args -> Map.of("found", true, "name", "Ada Lovelace"));
        failingTool = new StubToolHandler("book_appointment", List.of(), args -> {
            throw new IllegalStateException("calendar unavailable");
        });
        ToolRegistry registry = new ToolRegistry(List.of(lookupContact, failingTool), objectMapper);

        SessionConfig sessionConfig = new SessionConfig();
        sessionConfig.setPollIntervalMs(20);
        sessionConfig.setDrainGraceMs(1000);

        bridge = new SessionBridge(registry, sessionConfig, new ClientMessages(objectMapper), objectMapper,
                new SimpleAsyncTaskExecutor("test-pump-"));

        session = new RealtimeSession("s-1", "agent-1", client);
        session.attachAgent(AgentSnapshot.builder().agentId("agent-1").userId("user-1").pricingTier("premium")
                .active(true).build());
        session.attachUpstream(upstream);
        session.transitionTo(SessionState.CONFIGURING);
        session.transitionTo(SessionState.ACTIVE);
    }

    private CompletableFuture<TerminationCause> runInBackground() {
        return CompletableFuture.supplyAsync(() -> bridge.run(session));
    }

    @Test
    void toolResultIsSubmittedBeforeTheCallEventAndTheNextEventAreForwarded() throws Exception {
        upstream.emit(functionCallDone("call_1", "lookup_contact", LOOKUP_ARGS));
        upstream.emit(audioDelta("AAAA"));
        upstream.end();

        TerminationCause cause = bridge.run(session);

        assertThat(cause).isEqualTo(TerminationCause.UPSTREAM_CLOSED);
        assertThat(journal).containsExactly(
                "tool_result:call_1",
                "client:response.function_call_arguments.done",
                "client:response.audio.delta");
        assertThat(lookupContact.getReceivedArguments()).singleElement()
                .isEqualTo(objectMapper.readTree(LOOKUP_ARGS));
        assertThat(lookupContact.getReceivedContexts()).singleElement()
                .satisfies(context -> {
                    assertThat(context.getUserId()).isEqualTo("user-1");
                    assertThat(context.getCallId()).isEqualTo("call_1");
                });
        assertThat(upstream.getToolResult("call_1").isSuccess()).isTrue();
    }

    @Test
    void everyUpstreamEventIsForwardedInAnEnvelope() {
        upstream.emit(JsonFrames.event("{\"type\":\"session.created\",\"session\":{\"id\":\"sess_1\"}}"));
        upstream.emit(JsonFrames.event("{\"type\":\"rate_limits.updated\",\"rate_limits\":[]}"));
        upstream.end();

        bridge.run(session);

        assertThat(client.getSent()).hasSize(2);
        JsonNode first = JsonFrames.parse(client.getSent().get(0));
        assertThat(first.path("type").asText()).isEqualTo("session.created");
        assertThat(first.path("event").path("session").path("id").asText()).isEqualTo("sess_1");
        assertThat(JsonFrames.type(client.getSent().get(1))).isEqualTo("rate_limits.updated");
        assertThat(session.getEventsForwarded().get()).isEqualTo(2);
    }

    @Test
    void failingToolProducesFailureResultAndSessionStaysActive() throws Exception {
        CompletableFuture<TerminationCause> run = runInBackground();

        upstream.emit(functionCallDone("call_9", "book_appointment", "{}"));
        Await.until(() -> upstream.getToolResult("call_9") != null, 5000);
        Await.until(() -> client.getSent().size() == 1, 5000);

        ToolResult result = upstream.getToolResult("call_9");
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("calendar unavailable");
        assertThat(result.getErrorType()).isEqualTo(ToolErrorType.EXECUTION_ERROR);
        assertThat(session.getState()).isEqualTo(SessionState.ACTIVE);
        assertThat(session.isTerminating()).isFalse();
        assertThat(session.getToolCallsFailed().get()).isEqualTo(1);

        client.disconnect();
        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CLIENT_DISCONNECT);
    }

    @Test
    void unknownToolStillGetsAResult() throws Exception {
        upstream.emit(functionCallDone("call_2", "send_fax", "{}"));
        upstream.end();

        bridge.run(session);

        assertThat(upstream.getToolResult("call_2").getErrorType()).isEqualTo(ToolErrorType.UNKNOWN_TOOL);
    }

    @Test
    void repeatedCallIdIsSubmittedOnlyOnce() {
        upstream.emit(functionCallDone("call_1", "lookup_contact", LOOKUP_ARGS));
        upstream.emit(functionCallDone("call_1", "lookup_contact", LOOKUP_ARGS));
        upstream.end();

        bridge.run(session);

        assertThat(upstream.getToolResultCallIds()).containsExactly("call_1");
        assertThat(lookupContact.getReceivedArguments()).hasSize(1);
        assertThat(client.sentOfType("response.function_call_arguments.done")).hasSize(2);
    }

    @Test
    void callIdCanBeReusedOnceTheOutputWasAcknowledged() {
        upstream.emit(functionCallDone("call_1", "lookup_contact", LOOKUP_ARGS));
        upstream.emit(JsonFrames.event("{\"type\":\"conversation.item.created\","
                + "\"item\":{\"type\":\"function_call_output\",\"call_id\":\"call_1\"}}"));
        upstream.emit(functionCallDone("call_1", "lookup_contact", LOOKUP_ARGS));
        upstream.end();

        bridge.run(session);

        assertThat(upstream.getToolResultCallIds()).containsExactly("call_1", "call_1");
    }

    @Test
    void clientAudioReachesUpstreamUnmodified() throws Exception {
        byte[] frame = new byte[320];
        for (int i = 0; i < frame.length; i++) {
            frame[i] = (byte) (i * 7);
        }
        byte[] expected = frame.clone();

        CompletableFuture<TerminationCause> run = runInBackground();
        client.pushAudio(frame);
        Await.until(() -> upstream.getAudio().size() == 1, 5000);
        client.disconnect();

        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CLIENT_DISCONNECT);
        assertThat(upstream.getAudio().get(0)).hasSize(320).containsExactly(expected);
        assertThat(session.getAudioFramesForwarded().get()).isEqualTo(1);
    }

    @Test
    void audioAndToolResultsFlowConcurrently() throws Exception {
        int frames = 200;
        CompletableFuture<TerminationCause> run = runInBackground();

        for (int i = 0; i < frames; i++) {
            client.pushAudio(new byte[]{(byte) i, (byte) (i >> 8)});
            if (i == frames / 2) {
                upstream.emit(functionCallDone("call_mid", "lookup_contact", LOOKUP_ARGS));
            }
        }
        Await.until(() -> upstream.getAudio().size() == frames && upstream.getToolResult("call_mid") != null, 10000);
        client.disconnect();

        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(TerminationCause.CLIENT_DISCONNECT);
        assertThat(upstream.getAudio()).hasSize(frames);
        for (int i = 0; i < frames; i++) {
            assertThat(upstream.getAudio().get(i)).containsExactly((byte) i, (byte) (i >> 8));
        }
        assertThat(upstream.getToolResultCallIds()).containsExactly("call_mid");
    }

    @Test
    void forwardsWhitelistedClientControlMessages() throws Exception {
        CompletableFuture<TerminationCause> run = runInBackground();

        client.pushControl("{\"type\":\"response.cancel\"}");
        client.pushControl("{\"type\":\"ping\"}");
        client.pushControl("{\"type\":\"input_audio_buffer.commit\"}");
        Await.until(() -> upstream.getClientEvents().size() == 2, 5000);
        client.disconnect();

        run.get(5, TimeUnit.SECONDS);
        assertThat(upstream.getClientEvents()).containsExactly(
                "{\"type\":\"response.cancel\"}", "{\"type\":\"input_audio_buffer.commit\"}");
    }

    @Test
    void malformedClientFrameEndsTheSession() {
        client.pushControl("{not json");

        TerminationCause cause = bridge.run(session);

        assertThat(cause).isEqualTo(TerminationCause.MALFORMED_CLIENT_FRAME);
        assertThat(cause.isFailure()).isTrue();
        assertThat(session.getState()).isEqualTo(SessionState.DRAINING);
    }

    @Test
    void clientDisconnectIsNotAFailure() {
        client.disconnect();

        TerminationCause cause = bridge.run(session);

        assertThat(cause).isEqualTo(TerminationCause.CLIENT_DISCONNECT);
        assertThat(cause.isFailure()).isFalse();
    }

    @Test
    void upstreamErrorEventsAreForwardedWithoutEndingTheSession() throws Exception {
        CompletableFuture<TerminationCause> run = runInBackground();

        upstream.emit(JsonFrames.event("{\"type\":\"error\",\"error\":{\"message\":\"buffer too small\"}}"));
        Await.until(() -> client.getSent().size() == 1, 5000);
        assertThat(session.isTerminating()).isFalse();

        upstream.end();
        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(TerminationCause.UPSTREAM_CLOSED);
        assertThat(client.sentOfType("error")).hasSize(1);
    }

    @Test
    void externalTerminationStopsBothPumps() throws Exception {
        CompletableFuture<TerminationCause> run = runInBackground();
        Thread.sleep(50);

        session.terminate(TerminationCause.SHUTDOWN);

        assertThat(run.get(5, TimeUnit.SECONDS)).isEqualTo(TerminationCause.SHUTDOWN);
    }
}
