package com.voice_agent_backend.models;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionOutcome {
    String sessionId;
    String agentId;
    SessionState state;
    String reason;
    TerminationCause cause;

    public boolean isFailed() {
        return state == SessionState.FAILED;
    }
}
