package com.voice_agent_backend.services.tools.crm;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Contact;
import com.voice_agent_backend.repositories.ContactRepository;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class SearchContactsTool extends AbstractToolHandler {

    public static final String NAME = "search_contacts";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Search CRM contacts by name, email or phone number")
            .parameters(objectSchema(
                    Map.of(
                            "query", stringProperty("Part of a name, email address or phone number"),
                            "limit", integerProperty("Maximum number of contacts to return (1-20, default 5)")),
                    List.of("query")))
            .build();

    private final ContactRepository contactRepository;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        String query = requireText(arguments, "query");
        int limit = optionalInt(arguments, "limit", 5, 1, 20);

        List<Contact> contacts;
        try {
            contacts = contactRepository.search(userId, query, PageRequest.of(0, limit));
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Contact search failed", e);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("count", contacts.size());
        result.put("contacts", contacts.stream().map(AbstractToolHandler::describe).toList());
        return result;
    }
}
