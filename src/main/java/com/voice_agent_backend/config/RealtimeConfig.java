package com.voice_agent_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "openai.realtime")
@Data
public class RealtimeConfig {

    // Process-wide default key, used when the agent owner has none stored
    private String apiKey;
    private String baseUrl = "wss://api.openai.com/v1/realtime";
    private String model = "gpt-4o-realtime-preview-2024-12-17";
    private String voice = "shimmer";
    private List<String> modalities = new ArrayList<>(List.of("text", "audio"));
    private String audioFormat = "pcm16";
    private String transcriptionModel = "whisper-1";
    private String toolChoice = "auto";
    private String defaultInstructions = "You are a helpful voice assistant.";

    // Turn detection
    private String vadType = "server_vad";
    private double vadThreshold = 0.5;
    private int prefixPaddingMs = 300;
    private int silenceDurationMs = 500;

    // Deadlines
    private long connectTimeoutMs = 10000;
    private long configureTimeoutMs = 10000;

    // Outbound writer limits (per upstream transport)
    private int sendTimeLimitMs = 10000;
    private int sendBufferSizeLimit = 512 * 1024;

    private int eventQueueCapacity = 1024;
    private long eventEnqueueTimeoutMs = 5000;
    private boolean autoRespondAfterToolResult = true;
    private String userAgent = "Voice-Agent-Realtime/1.0";

    public String getWebSocketUrl() {
        return baseUrl + "?model=" + model;
    }

    public boolean hasDefaultApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
