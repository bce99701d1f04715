package com.voice_agent_backend.models;

import java.util.EnumSet;
import java.util.Set;

public enum SessionState {
    INITIALIZING,
    CONFIGURING,
    ACTIVE,
    DRAINING,
    CLOSED,
    FAILED;

    public boolean isTerminal() {
        return this == CLOSED || this == FAILED;
    }

    /**
     * Forward-only lifecycle; FAILED is reachable from every non-terminal state.
     */
    public Set<SessionState> allowedNext() {
        return switch (this) {
            case INITIALIZING -> EnumSet.of(CONFIGURING, FAILED);
            case CONFIGURING -> EnumSet.of(ACTIVE, FAILED);
            case ACTIVE -> EnumSet.of(DRAINING, FAILED);
            case DRAINING -> EnumSet.of(CLOSED, FAILED);
            case CLOSED, FAILED -> EnumSet.noneOf(SessionState.class);
        };
    }

    public boolean canTransitionTo(SessionState next) {
        return allowedNext().contains(next);
    }
}
