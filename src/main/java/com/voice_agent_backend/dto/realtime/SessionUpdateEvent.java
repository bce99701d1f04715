package com.voice_agent_backend.dto.realtime;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.voice_agent_backend.services.tools.ToolSchema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionUpdateEvent {
    private String type = "session.update";
    private SessionConfig session;

    public SessionUpdateEvent(SessionConfig session) {
        this.session = session;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class SessionConfig {
        private List<String> modalities;
        private String instructions;
        private String voice;
        @JsonProperty("input_audio_format")
        private String inputAudioFormat;
        @JsonProperty("output_audio_format")
        private String outputAudioFormat;
        @JsonProperty("input_audio_transcription")
        private TranscriptionConfig inputAudioTranscription;
        @JsonProperty("turn_detection")
        private TurnDetectionConfig turnDetection;
        private List<ToolSchema> tools;
        @JsonProperty("tool_choice")
        private String toolChoice;

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class TranscriptionConfig {
            private String model;
        }

        @Data
        @NoArgsConstructor
        @AllArgsConstructor
        public static class TurnDetectionConfig {
            private String type;
            private Double threshold;
            @JsonProperty("prefix_padding_ms")
            private Integer prefixPaddingMs;
            @JsonProperty("silence_duration_ms")
            private Integer silenceDurationMs;
        }
    }
}
