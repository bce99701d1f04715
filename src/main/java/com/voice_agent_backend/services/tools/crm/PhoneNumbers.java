package com.voice_agent_backend.services.tools.crm;

import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.InvalidToolArgumentsException;

public final class PhoneNumbers {

    private PhoneNumbers() {
    }

    /**
     * Strip formatting so "+1 (555) 123-4567" and "+15551234567" match. A leading '+' is kept.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        StringBuilder digits = new StringBuilder(trimmed.length());
        if (trimmed.startsWith("+")) {
            digits.append('+');
        }
        int digitCount = 0;
        for (char c : trimmed.toCharArray()) {
            if (Character.isDigit(c)) {
                digits.append(c);
                digitCount++;
            }
        }
        if (digitCount < 7 || digitCount > 15) {
            throw new InvalidToolArgumentsException("Not a valid phone number: " + raw);
        }
        return digits.toString();
    }
}
