package com.voice_agent_backend.services.tools;

public enum ToolErrorType {
    UNKNOWN_TOOL,
    INVALID_ARGUMENTS,
    EXECUTION_ERROR
}
