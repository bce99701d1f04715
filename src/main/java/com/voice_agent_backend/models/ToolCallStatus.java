package com.voice_agent_backend.models;

public enum ToolCallStatus {
    PENDING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }
}
