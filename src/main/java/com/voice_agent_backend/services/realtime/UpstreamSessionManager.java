package com.voice_agent_backend.services.realtime;

import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ConfigurationException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.UpstreamUnavailableException;

public interface UpstreamSessionManager {

    /**
     * Open and configure a connection for one session. Returns only once the service has
     * acknowledged the session configuration.
     *
     * @throws ConfigurationException      if no credential is available
     * @throws UpstreamUnavailableException if connecting or configuring fails or times out
     */
    UpstreamConnection connect(UpstreamSessionConfig config);
}
