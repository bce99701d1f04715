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
public class CreateContactTool extends AbstractToolHandler {

    public static final String NAME = "create_contact";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Save a new caller to the CRM. If the phone number is already known the "
                    + "existing contact is returned instead.")
            .parameters(objectSchema(
                    Map.of(
                            "first_name", stringProperty("Caller's first name"),
                            "last_name", stringProperty("Caller's last name"),
                            "phone", stringProperty("Phone number in E.164 format"),
                            "email", stringProperty("Email address"),
                            "company_name", stringProperty("Company the caller works for"),
                            "notes", stringProperty("Anything worth remembering about the caller")),
                    List.of("first_name", "phone")))
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

        try {
            Optional<Contact> existing = contactRepository.findFirstByUserIdAndPhoneNumber(userId, phone);
            Map<String, Object> result = new LinkedHashMap<>();
            if (existing.isPresent()) {
                result.put("created", false);
                result.put("contact", describe(existing.get()));
                return result;
            }

            Contact contact = new Contact();
            contact.setUserId(userId);
            contact.setFirstName(requireText(arguments, "first_name"));
            contact.setLastName(optionalText(arguments, "last_name"));
            contact.setPhoneNumber(phone);
            contact.setEmail(optionalText(arguments, "email"));
            contact.setCompanyName(optionalText(arguments, "company_name"));
            contact.setNotes(optionalText(arguments, "notes"));
            Contact saved = contactRepository.save(contact);

            log.info("Created contact {} for user {}", saved.getId(), userId);
            result.put("created", true);
            result.put("contact", describe(saved));
            return result;
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not save contact", e);
        }
    }
}
