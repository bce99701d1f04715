package com.voice_agent_backend.models;

import lombok.Getter;

import java.util.HashMap;
import java.util.Map;

/**
 * Event kinds emitted by the realtime model service, keyed by their wire {@code type}.
 */
@Getter
public enum UpstreamEventType {
    SESSION_CREATED("session.created"),
    SESSION_UPDATED("session.updated"),
    SPEECH_STARTED("input_audio_buffer.speech_started"),
    SPEECH_STOPPED("input_audio_buffer.speech_stopped"),
    INPUT_TRANSCRIPTION_COMPLETED("conversation.item.input_audio_transcription.completed"),
    CONVERSATION_ITEM_CREATED("conversation.item.created"),
    AUDIO_DELTA("response.audio.delta"),
    AUDIO_DONE("response.audio.done"),
    TRANSCRIPT_DELTA("response.audio_transcript.delta"),
    TRANSCRIPT_DONE("response.audio_transcript.done"),
    FUNCTION_CALL_ARGUMENTS_DONE("response.function_call_arguments.done"),
    RESPONSE_DONE("response.done"),
    ERROR("error"),
    OTHER(null);

    private static final Map<String, UpstreamEventType> BY_WIRE_TYPE = new HashMap<>();

    static {
        for (UpstreamEventType type : values()) {
            if (type.wireType != null) {
                BY_WIRE_TYPE.put(type.wireType, type);
            }
        }
    }

    private final String wireType;

    UpstreamEventType(String wireType) {
        this.wireType = wireType;
    }

    public static UpstreamEventType fromWireType(String wireType) {
        if (wireType == null) {
            return OTHER;
        }
        return BY_WIRE_TYPE.getOrDefault(wireType, OTHER);
    }
}
