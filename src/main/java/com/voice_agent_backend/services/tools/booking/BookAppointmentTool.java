package com.voice_agent_backend.services.tools.booking;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.Contact;
import com.voice_agent_backend.repositories.AppointmentRepository;
import com.voice_agent_backend.repositories.ContactRepository;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
import com.voice_agent_backend.services.tools.crm.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class BookAppointmentTool extends AbstractToolHandler {

    public static final String NAME = "book_appointment";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Book an appointment for a known contact. Check availability first.")
            .parameters(objectSchema(
                    Map.of(
                            "phone", stringProperty("Contact phone number in E.164 format"),
                            "start_time", stringProperty("Start time, ISO format YYYY-MM-DDTHH:MM"),
                            "duration_minutes", integerProperty("Length in minutes"),
                            "service_type", stringProperty("What the appointment is for"),
                            "notes", stringProperty("Extra details from the caller")),
                    List.of("phone", "start_time")))
            .build();

    private final ContactRepository contactRepository;
    private final AppointmentRepository appointmentRepository;
    private final BookingCalendar calendar;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        String phone = PhoneNumbers.normalize(requireText(arguments, "phone"));
        LocalDateTime start = requireDateTime(arguments, "start_time");
        int duration = optionalInt(arguments, "duration_minutes", calendar.defaultDuration(),
                BookingCalendar.MIN_DURATION_MINUTES, BookingCalendar.MAX_DURATION_MINUTES);
        calendar.requireBookable(start, duration);

        try {
            Contact contact = contactRepository.findFirstByUserIdAndPhoneNumber(userId, phone)
                    .orElseThrow(() -> new ToolExecutionException(
                            "No contact with phone " + phone + "; create the contact first"));
            return calendar.withUserLock(userId, () -> book(arguments, userId, contact, start, duration));
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not save appointment", e);
        }
    }

    private Map<String, Object> book(JsonNode arguments, String userId, Contact contact,
                                     LocalDateTime start, int duration) {
        Map<String, Object> result = new LinkedHashMap<>();
        if (!calendar.findConflicts(userId, start, duration, null).isEmpty()) {
            result.put("booked", false);
            result.put("reason", "That time is already taken");
            result.put("alternatives", calendar.freeSlots(userId, start.toLocalDate(), duration).stream()
                    .limit(3)
                    .map(LocalDateTime::toString)
                    .toList());
            return result;
        }

        Appointment appointment = new Appointment();
        appointment.setContact(contact);
        appointment.setUserId(userId);
        appointment.setStartTime(start);
        appointment.setDurationMinutes(duration);
        appointment.setServiceType(optionalText(arguments, "service_type"));
        appointment.setNotes(optionalText(arguments, "notes"));
        Appointment saved = appointmentRepository.save(appointment);

        log.info("Booked appointment {} for contact {} at {}", saved.getId(), contact.getId(), start);
        result.put("booked", true);
        result.put("appointment", describe(saved));
        return result;
    }
}
