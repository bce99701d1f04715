package com.voice_agent_backend.services.tools.booking;

import com.fasterxml.jackson.databind.JsonNode;
import com.voice_agent_backend.config.BookingConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.AppointmentStatus;
import com.voice_agent_backend.models.Contact;
import com.voice_agent_backend.repositories.AppointmentRepository;
import com.voice_agent_backend.repositories.ContactRepository;
import com.voice_agent_backend.services.tools.AbstractToolHandler;
import com.voice_agent_backend.services.tools.ToolContext;
import com.voice_agent_backend.services.tools.ToolSchema;
import com.voice_agent_backend.services.tools.crm.PhoneNumbers;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class ListAppointmentsTool extends AbstractToolHandler {

    public static final String NAME = "list_appointments";

    private static final ToolSchema SCHEMA = ToolSchema.builder()
            .name(NAME)
            .description("List a caller's upcoming appointments")
            .parameters(objectSchema(
                    Map.of("phone", stringProperty("Contact phone number in E.164 format")),
                    List.of("phone")))
            .build();

    private final ContactRepository contactRepository;
    private final AppointmentRepository appointmentRepository;
    private final BookingConfig bookingConfig;

    @Override
    public ToolSchema getSchema() {
        return SCHEMA;
    }

    @Override
    public Map<String, Object> execute(JsonNode arguments, ToolContext context) {
        String userId = requireUser(context);
        String phone = PhoneNumbers.normalize(requireText(arguments, "phone"));

        Map<String, Object> result = new LinkedHashMap<>();
        try {
            Optional<Contact> contact = contactRepository.findFirstByUserIdAndPhoneNumber(userId, phone);
            if (contact.isEmpty()) {
                result.put("found", false);
                result.put("appointments", List.of());
                return result;
            }

            List<Appointment> upcoming = appointmentRepository
                    .findByUserIdAndContact_IdAndStatusAndStartTimeAfterOrderByStartTime(
                            userId, contact.get().getId(), AppointmentStatus.SCHEDULED, LocalDateTime.now(),
                            PageRequest.of(0, bookingConfig.getMaxListedAppointments()));

            result.put("found", true);
            result.put("count", upcoming.size());
            result.put("appointments", upcoming.stream().map(AbstractToolHandler::describe).toList());
            return result;
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not load appointments", e);
        }
    }
}
