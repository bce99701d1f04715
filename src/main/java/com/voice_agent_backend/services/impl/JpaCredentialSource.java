package com.voice_agent_backend.services.impl;

import com.voice_agent_backend.models.UserSettings;
import com.voice_agent_backend.repositories.UserSettingsRepository;
import com.voice_agent_backend.services.CredentialSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaCredentialSource implements CredentialSource {

    private final UserSettingsRepository userSettingsRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findApiKey(String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return userSettingsRepository.findById(userId)
                .map(UserSettings::getOpenaiApiKey)
                .map(String::trim)
                .filter(key -> !key.isEmpty());
    }
}
