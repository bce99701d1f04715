package com.voice_agent_backend.models;

import com.voice_agent_backend.services.realtime.UpstreamConnection;
import com.voice_agent_backend.services.transport.ClientTransport;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live call, from accepting the client socket until both ends are released.
 * State changes are serialized on the session; the termination signal is shared by
 * both pumps and completes once, with the first cause reported.
 */
@Slf4j
@Getter
public class RealtimeSession {

    private final String sessionId;
    private final String agentId;
    private final Instant createdAt;
    private final ClientTransport clientTransport;

    private volatile AgentSnapshot agent;
    private volatile UpstreamConnection upstream;
    private volatile SessionState state = SessionState.INITIALIZING;
    private volatile String failureReason;
    private volatile Instant endedAt;

    private final CompletableFuture<TerminationCause> termination = new CompletableFuture<>();

    private final AtomicLong audioFramesForwarded = new AtomicLong();
    private final AtomicLong eventsForwarded = new AtomicLong();
    private final AtomicLong toolCallsCompleted = new AtomicLong();
    private final AtomicLong toolCallsFailed = new AtomicLong();

    public RealtimeSession(String sessionId, String agentId, ClientTransport clientTransport) {
        this.sessionId = sessionId;
        this.agentId = agentId;
        this.clientTransport = clientTransport;
        this.createdAt = Instant.now();
    }

    public void attachAgent(AgentSnapshot agent) {
        this.agent = agent;
    }

    public void attachUpstream(UpstreamConnection upstream) {
        this.upstream = upstream;
    }

    /**
     * Move to {@code next} if the lifecycle allows it. Re-entering CLOSED is a no-op.
     *
     * @return true if the session is in {@code next} afterwards
     */
    public synchronized boolean transitionTo(SessionState next) {
        if (state == next && next == SessionState.CLOSED) {
            return true;
        }
        if (!state.canTransitionTo(next)) {
            log.debug("Session {} ignoring transition {} -> {}", sessionId, state, next);
            return false;
        }
        log.debug("Session {} state {} -> {}", sessionId, state, next);
        state = next;
        if (next.isTerminal()) {
            endedAt = Instant.now();
        }
        return true;
    }

    /**
     * Move to FAILED from any non-terminal state. The first reason is kept.
     */
    public synchronized boolean fail(String reason) {
        if (state.isTerminal()) {
            return false;
        }
        if (failureReason == null) {
            failureReason = reason;
        }
        return transitionTo(SessionState.FAILED);
    }

    /**
     * Report a terminating condition. Only the first report is recorded; the session moves
     * to DRAINING if it was ACTIVE.
     *
     * @return true if this call recorded the cause
     */
    public boolean terminate(TerminationCause cause) {
        boolean first = termination.complete(cause);
        if (first) {
            log.info("Session {} terminating: {}", sessionId, cause.getDescription());
            synchronized (this) {
                if (state == SessionState.ACTIVE) {
                    transitionTo(SessionState.DRAINING);
                }
            }
        }
        return first;
    }

    public boolean isTerminating() {
        return termination.isDone();
    }

    public TerminationCause getTerminationCause() {
        return termination.getNow(null);
    }
}
