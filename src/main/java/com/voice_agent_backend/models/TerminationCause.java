package com.voice_agent_backend.models;

import lombok.Getter;

/**
 * Why a session left the ACTIVE state. The first cause recorded for a session wins.
 */
@Getter
public enum TerminationCause {
    CLIENT_DISCONNECT(false, "client disconnected"),
    UPSTREAM_CLOSED(true, "upstream connection closed"),
    UPSTREAM_TRANSPORT_ERROR(true, "upstream transport error"),
    CLIENT_TRANSPORT_ERROR(true, "client transport error"),
    MALFORMED_CLIENT_FRAME(true, "malformed client frame"),
    SHUTDOWN(true, "server shutting down"),
    INTERNAL_ERROR(true, "internal error");

    private final boolean failure;
    private final String description;

    TerminationCause(boolean failure, String description) {
        this.failure = failure;
        this.description = description;
    }
}
