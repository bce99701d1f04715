package com.voice_agent_backend.services.realtime;

import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;
import com.voice_agent_backend.services.tools.ToolResult;

/**
 * A configured connection to the realtime model service. Sends are safe to call from
 * several threads; {@link #events()} may only be taken once.
 */
public interface UpstreamConnection {

    String getId();

    UpstreamEventSequence events();

    void sendAudio(byte[] pcm) throws UpstreamUnavailableException;

    void sendToolResult(String callId, ToolResult result) throws UpstreamUnavailableException;

    /**
     * Pass a client control message (already validated JSON) through unchanged.
     */
    void sendClientEvent(String json) throws UpstreamUnavailableException;

    boolean isOpen();

    void close();
}
