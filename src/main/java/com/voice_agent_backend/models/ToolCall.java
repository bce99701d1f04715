package com.voice_agent_backend.models;

import com.voice_agent_backend.services.tools.ToolResult;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * One function call requested by the upstream model, tracked from argument completion
 * until its result has been handed back upstream.
 */
@Getter
@ToString
public class ToolCall {

    private final String callId;
    private final String toolName;
    private final String arguments;
    private final Instant openedAt;
    private volatile ToolCallStatus status = ToolCallStatus.PENDING;
    private volatile ToolResult result;
    private volatile boolean submitted;

    public ToolCall(String callId, String toolName, String arguments) {
        this.callId = callId;
        this.toolName = toolName;
        this.arguments = arguments;
        this.openedAt = Instant.now();
    }

    public void markExecuting() {
        this.status = ToolCallStatus.EXECUTING;
    }

    public void complete(ToolResult result) {
        this.result = result;
        this.status = result.isSuccess() ? ToolCallStatus.COMPLETED : ToolCallStatus.FAILED;
    }

    public void markSubmitted() {
        this.submitted = true;
    }
}
