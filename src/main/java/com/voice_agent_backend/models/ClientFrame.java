package com.voice_agent_backend.models;

import lombok.Getter;

/**
 * A frame received from the calling party: raw audio, a JSON control message, or the
 * end of the stream.
 */
@Getter
public class ClientFrame {

    public enum Kind {
        AUDIO,
        CONTROL,
        DISCONNECT
    }

    private final Kind kind;
    private final byte[] audio;
    private final String text;

    private ClientFrame(Kind kind, byte[] audio, String text) {
        this.kind = kind;
        this.audio = audio;
        this.text = text;
    }

    public static ClientFrame audio(byte[] audio) {
        return new ClientFrame(Kind.AUDIO, audio, null);
    }

    public static ClientFrame control(String text) {
        return new ClientFrame(Kind.CONTROL, null, text);
    }

    public static ClientFrame disconnect(String reason) {
        return new ClientFrame(Kind.DISCONNECT, null, reason);
    }
}
