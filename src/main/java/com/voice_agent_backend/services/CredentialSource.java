package com.voice_agent_backend.services;

import java.util.Optional;

/**
 * Per-user credentials for the realtime model service.
 */
public interface CredentialSource {

    /**
     * @return the user's own API key, if one is stored and non-blank
     */
    Optional<String> findApiKey(String userId);
}
