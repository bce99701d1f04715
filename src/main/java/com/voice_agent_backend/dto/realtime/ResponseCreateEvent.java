package com.voice_agent_backend.dto.realtime;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Asks the model to produce a response, e.g. to speak a tool result it just received.
 */
@Data
@NoArgsConstructor
public class ResponseCreateEvent {
    private String type = "response.create";
}
