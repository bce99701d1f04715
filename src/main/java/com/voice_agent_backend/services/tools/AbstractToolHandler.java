package com.voice_agent_backend.services.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.InvalidToolArgumentsException;
import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.Contact;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Argument parsing and result shaping shared by the built-in CRM and booking tools.
 */
public abstract class AbstractToolHandler implements ToolHandler {

    protected static Map<String, Object> stringProperty(String description) {
        return Map.of("type", "string", "description", description);
    }

    protected static Map<String, Object> integerProperty(String description) {
        return Map.of("type", "integer", "description", description);
    }

    protected static Map<String, Object> objectSchema(Map<String, Object> properties, List<String> required) {
        return Map.of("type", "object", "properties", properties, "required", required);
    }

    protected String requireText(JsonNode arguments, String name) {
        String value = optionalText(arguments, name);
        if (value == null) {
            throw new InvalidToolArgumentsException("Missing required argument: " + name);
        }
        return value;
    }

    protected String optionalText(JsonNode arguments, String name) {
        JsonNode node = arguments.get(name);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isValueNode()) {
            throw new InvalidToolArgumentsException("Argument '" + name + "' must be a string");
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }

    protected int optionalInt(JsonNode arguments, String name, int defaultValue, int min, int max) {
        JsonNode node = arguments.get(name);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        int value;
        if (node.canConvertToInt()) {
            value = node.asInt();
        } else if (node.isTextual()) {
            try {
                value = Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidToolArgumentsException("Argument '" + name + "' must be an integer", e);
            }
        } else {
            throw new InvalidToolArgumentsException("Argument '" + name + "' must be an integer");
        }
        if (value < min || value > max) {
            throw new InvalidToolArgumentsException(
                    "Argument '" + name + "' must be between " + min + " and " + max);
        }
        return value;
    }

    protected long requireLong(JsonNode arguments, String name) {
        String text = requireText(arguments, name);
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new InvalidToolArgumentsException("Argument '" + name + "' must be a number", e);
        }
    }

    /**
     * ISO-8601 local date-time; an offset, if present, is dropped.
     */
    protected LocalDateTime requireDateTime(JsonNode arguments, String name) {
        String text = requireText(arguments, name);
        try {
            return LocalDateTime.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                throw new InvalidToolArgumentsException(
                        "Argument '" + name + "' must be an ISO date-time like 2025-01-15T14:30", e);
            }
        }
    }

    protected LocalDate requireDate(JsonNode arguments, String name) {
        String text = requireText(arguments, name);
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            throw new InvalidToolArgumentsException("Argument '" + name + "' must be a date like 2025-01-15", e);
        }
    }

    protected String requireUser(ToolContext context) {
        if (context == null || context.getUserId() == null) {
            throw new InvalidToolArgumentsException("Tool '" + getName() + "' requires an owning user");
        }
        return context.getUserId();
    }

    protected static Map<String, Object> describe(Contact contact) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", contact.getId());
        view.put("name", contact.getFullName());
        view.put("first_name", contact.getFirstName());
        view.put("last_name", contact.getLastName());
        view.put("phone", contact.getPhoneNumber());
        view.put("email", contact.getEmail());
        view.put("company", contact.getCompanyName());
        view.put("status", contact.getStatus());
        view.put("tags", contact.getTags());
        return view;
    }

    protected static Map<String, Object> describe(Appointment appointment) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("appointment_id", appointment.getId());
        view.put("contact_id", appointment.getContact().getId());
        view.put("contact_name", appointment.getContact().getFullName());
        view.put("start_time", appointment.getStartTime().toString());
        view.put("duration_minutes", appointment.getDurationMinutes());
        view.put("service_type", appointment.getServiceType());
        view.put("status", appointment.getStatus().name().toLowerCase());
        return view;
    }
}
