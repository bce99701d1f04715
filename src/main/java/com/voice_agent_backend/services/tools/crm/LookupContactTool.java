package com.voice_agent_backend.services.tools.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Contact;
import com.voice_agent_backend.repositories.ContactRepository;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class LookupContactTool extends AbstractToolHandler {

    public static final String NAME = "lookup_contact";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Look up a customer in the CRM by phone number. Use it at the start of a call "
                    + "to greet returning callers by name.")
            .parameters(objectSchema(
                    Map.of("phone", stringProperty("Phone number in E.164 format, e.g. +15551234567")),
                    List.of("phone")))
            .build();

    private final ContactRepository contactRepository;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        String phone = PhoneNumbers.normalize(requireText(arguments, "phone"));

        Optional<Contact> contact;
        try {
            contact = contactRepository.findFirstByUserIdAndPhoneNumber(userId, phone);
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Contact lookup failed", e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("found", contact.isPresent());
        contact.ifPresentOrElse(
                c -> result.put("contact", describe(c)),
                () -> result.put("message", "No contact found for " + phone));
        log.debug("Contact lookup for {} found={}", phone, contact.isPresent());
        return result;
    }
}
