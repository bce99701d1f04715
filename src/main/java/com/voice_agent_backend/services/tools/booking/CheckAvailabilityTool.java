package com.voice_agent_backend.services.tools.booking;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class CheckAvailabilityTool extends AbstractToolHandler {

    public static final String NAME = "check_availability";

    private static final DateTimeFormatter SLOT_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("List open appointment slots on a given day")
            .parameters(objectSchema(
                    Map.of(
                            "date", stringProperty("Day to check, YYYY-MM-DD"),
                            "duration_minutes", integerProperty("Length of the appointment in minutes")),
                    List.of("date")))
            .build();

    private final BookingCalendar calendar;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        LocalDate date = requireDate(arguments, "date");
        int duration = optionalInt(arguments, "duration_minutes", calendar.defaultDuration(),
                BookingCalendar.MIN_DURATION_MINUTES, BookingCalendar.MAX_DURATION_MINUTES);

        List<LocalDateTime> slots = calendar.freeSlots(userId, date, duration);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("date", date.toString());
        result.put("duration_minutes", duration);
        result.put("available", !slots.isEmpty());
        result.put("slots", slots.stream().map(SLOT_FORMAT::format).toList());
        return result;
    }
}
