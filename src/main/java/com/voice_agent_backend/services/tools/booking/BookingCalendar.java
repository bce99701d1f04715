package com.voice_agent_backend.services.tools.booking;

import com.voice_agent_backend.config.BookingConfig;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.InvalidToolArgumentsException;
import com.voice_agent_backend.exceptions.VoiceAgentExceptionHandler.ToolExecutionException;
import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.AppointmentStatus;
import com.voice_agent_backend.repositories.AppointmentRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Business-hours and overlap rules shared by the booking tools.
 */
@Component
@RequiredArgsConstructor
public class BookingCalendar {

    static final int MIN_DURATION_MINUTES = 5;
    static final int MAX_DURATION_MINUTES = 480;

    private final AppointmentRepository appointmentRepository;
    private final BookingConfig bookingConfig;
    private final ConcurrentHashMap<String, Object> userLocks = new ConcurrentHashMap<>();

    /**
     * Runs a conflict check and the write that depends on it as one step for {@code userId}.
     * Saves inside {@code action} must commit before it returns, so callers stay outside any
     * surrounding transaction.
     */
    public <T> T withUserLock(String userId, Supplier<T> action) {
        Object lock = userLocks.computeIfAbsent(userId, key -> new Object());
        synchronized (lock) {
            return action.get();
        }
    }

    public void requireBookable(LocalDateTime start, int durationMinutes) {
        if (start.isBefore(LocalDateTime.now())) {
            throw new InvalidToolArgumentsException("Cannot book a time in the past: " + start);
        }
        LocalDateTime open = start.toLocalDate().atTime(bookingConfig.getOpenHour(), 0);
        LocalDateTime close = start.toLocalDate().atTime(bookingConfig.getCloseHour(), 0);
        if (start.isBefore(open) || start.plusMinutes(durationMinutes).isAfter(close)) {
            throw new InvalidToolArgumentsException(String.format(
                    "Appointments must be between %02d:00 and %02d:00",
                    bookingConfig.getOpenHour(), bookingConfig.getCloseHour()));
        }
    }

    /**
     * Scheduled appointments overlapping {@code [start, start + duration)}, ignoring {@code excludeId}.
     */
    public List<Appointment> findConflicts(String userId, LocalDateTime start, int durationMinutes, Long excludeId) {
        LocalDateTime end = start.plusMinutes(durationMinutes);
        return scheduledAround(userId, start.toLocalDate(), end).stream()
                .filter(a -> !Objects.equals(a.getId(), excludeId))
                .filter(a -> a.overlaps(start, end))
                .toList();
    }

    public List<LocalDateTime> freeSlots(String userId, LocalDate date, int durationMinutes) {
        LocalDateTime dayClose = date.atTime(bookingConfig.getCloseHour(), 0);
        List<Appointment> booked = scheduledAround(userId, date, dayClose);
        LocalDateTime now = LocalDateTime.now();

        List<LocalDateTime> slots = new ArrayList<>();
        LocalDateTime slot = date.atTime(LocalTime.of(bookingConfig.getOpenHour(), 0));
        while (!slot.plusMinutes(durationMinutes).isAfter(dayClose)) {
            LocalDateTime slotStart = slot;
            LocalDateTime slotEnd = slot.plusMinutes(durationMinutes);
            boolean taken = booked.stream().anyMatch(a -> a.overlaps(slotStart, slotEnd));
            if (!taken && slotStart.isAfter(now)) {
                slots.add(slotStart);
            }
            slot = slot.plusMinutes(bookingConfig.getSlotMinutes());
        }
        return slots;
    }

    public int defaultDuration() {
        return bookingConfig.getDefaultDurationMinutes();
    }

    // Appointments starting the day before may still run into this one.
    private List<Appointment> scheduledAround(String userId, LocalDate date, LocalDateTime end) {
        try {
            return appointmentRepository.findInWindow(
                    userId, AppointmentStatus.SCHEDULED, date.minusDays(1).atStartOfDay(), end);
        } catch (DataAccessException e) {
            throw new ToolExecutionException("Could not read the appointment calendar", e);
        }
    }
}
