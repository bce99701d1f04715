package com.voice_agent_backend.repositories;

import com.voice_agent_backend.models.Appointment;
import com.voice_agent_backend.models.AppointmentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, Long> {

    Optional<Appointment> findByIdAndUserId(Long id, String userId);

    /**
     * Appointments with the given status that start before {@code end} and on or after
     * {@code windowStart}. Callers filter exact overlaps.
     */
    @Query("SELECT a FROM Appointment a WHERE a.userId = :userId AND a.status = :status "
            + "AND a.startTime < :end AND a.startTime >= :windowStart ORDER BY a.startTime")
    List<Appointment> findInWindow(@Param("userId") String userId,
                                   @Param("status") AppointmentStatus status,
                                   @Param("windowStart") LocalDateTime windowStart,
                                   @Param("end") LocalDateTime end);

    List<Appointment> findByUserIdAndContact_IdAndStatusAndStartTimeAfterOrderByStartTime(
            String userId, Long contactId, AppointmentStatus status, LocalDateTime after, Pageable pageable);
}
