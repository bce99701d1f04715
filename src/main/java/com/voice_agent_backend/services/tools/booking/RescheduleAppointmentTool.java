package com.voice_agent_backend.services.tools.booking;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.AppointmentStatus;
import com.voice_agent_backend.repositories.AppointmentRepository;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
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
public class RescheduleAppointmentTool extends AbstractToolHandler {

    public static final String NAME = "reschedule_appointment";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Move a scheduled appointment to a new start time, keeping its length")
            .parameters(objectSchema(
                    Map.of(
                            "appointment_id", integerProperty("Id of the appointment to move"),
                            "new_start_time", stringProperty("New start time, ISO format YYYY-MM-DDTHH:MM")),
                    List.of("appointment_id", "new_start_time")))
            .build();

    private final AppointmentRepository appointmentRepository;
    private final BookingCalendar calendar;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        long appointmentId = requireLong(arguments, "appointment_id");
        LocalDateTime newStart = requireDateTime(arguments, "new_start_time");

        try {
            return calendar.withUserLock(userId, () -> reschedule(userId, appointmentId, newStart));
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not reschedule appointment", e);
        }
    }

    private Map<String, Object> reschedule(String userId, long appointmentId, LocalDateTime newStart) {
        Appointment appointment = appointmentRepository.findByIdAndUserId(appointmentId, userId)
                .orElseThrow(() -> new ToolExecutionException("Appointment not found: " + appointmentId));
        if (appointment.getStatus() != AppointmentStatus.SCHEDULED) {
            throw new ToolExecutionException("Only scheduled appointments can be moved");
        }

        int duration = appointment.getDurationMinutes();
        calendar.requireBookable(newStart, duration);

        Map<String, Object> result = new LinkedHashMap<>();
        if (!calendar.findConflicts(userId, newStart, duration, appointment.getId()).isEmpty()) {
            result.put("rescheduled", false);
            result.put("reason", "That time is already taken");
            return result;
        }

        LocalDateTime previousStart = appointment.getStartTime();
        appointment.setStartTime(newStart);
        Appointment saved = appointmentRepository.save(appointment);

        log.info("Rescheduled appointment {} from {} to {}", appointmentId, previousStart, newStart);
        result.put("rescheduled", true);
        result.put("previous_start_time", previousStart.toString());
        result.put("appointment", describe(saved));
        return result;
    }
}
