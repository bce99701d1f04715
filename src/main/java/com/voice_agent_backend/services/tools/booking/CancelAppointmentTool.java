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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class CancelAppointmentTool extends AbstractToolHandler {

    public static final String NAME = "cancel_appointment";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("Cancel a scheduled appointment")
            .parameters(objectSchema(
                    Map.of(
                            "appointment_id", integerProperty("Id returned by list_appointments or book_appointment"),
                            "reason", stringProperty("Why the caller is cancelling")),
                    List.of("appointment_id")))
            .build();

    private final AppointmentRepository appointmentRepository;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        long appointmentId = requireLong(arguments, "appointment_id");

        Map<String, Object> result = new LinkedHashMap<>();
        try {
            Appointment appointment = appointmentRepository.findByIdAndUserId(appointmentId, userId)
                    .orElseThrow(() -> new ToolExecutionException("Appointment not found: " + appointmentId));

            if (appointment.getStatus() != AppointmentStatus.SCHEDULED) {
                result.put("cancelled", false);
                result.put("reason", "Appointment is already " + appointment.getStatus().name().toLowerCase());
                return result;
            }

            appointment.setStatus(AppointmentStatus.CANCELLED);
            appointment.setCancellationReason(optionalText(arguments, "reason"));
            Appointment saved = appointmentRepository.save(appointment);

            log.info("Cancelled appointment {}", appointmentId);
            result.put("cancelled", true);
            result.put("appointment", describe(saved));
            return result;
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not cancel appointment", e);
        }
    }
}
