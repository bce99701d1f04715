package com.voice_agent_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the client-facing side of a realtime session: gating, pump timing and frame limits.
 */
@ConfigurationProperties(prefix = "voice.realtime.session")
@Data
public class SessionConfig {

    // Only agents on this tier may open a realtime session
    private String eligibleTier = "premium";

    private long pollIntervalMs = 200;
    private long drainGraceMs = 2000;

    private int clientQueueCapacity = 256;
    private long clientEnqueueTimeoutMs = 1000;
    private int maxBinaryMessageBytes = 256 * 1024;
    private int maxTextMessageBytes = 64 * 1024;

    // Client control messages passed through to the upstream conversation
    private List<String> forwardedClientEvents = new ArrayList<>(List.of(
            "response.cancel",
            "response.create",
            "input_audio_buffer.commit",
            "input_audio_buffer.clear"
    ));
}
