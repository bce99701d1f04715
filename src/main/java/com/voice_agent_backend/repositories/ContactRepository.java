package com.voice_agent_backend.repositories;

import com.voice_agent_backend.models.Contact;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ContactRepository extends JpaRepository<Contact, Long> {

    Optional<Contact> findFirstByUserIdAndPhoneNumber(String userId, String phoneNumber);

    Optional<Contact> findByIdAndUserId(Long id, String userId);

    /**
     * Case-insensitive match on name, email or phone
     */
    @Query("SELECT c FROM Contact c WHERE c.userId = :userId AND ("
            + "LOWER(c.firstName) LIKE LOWER(CONCAT('%', :query, '%')) OR "
            + "LOWER(c.lastName) LIKE LOWER(CONCAT('%', :query, '%')) OR "
            + "LOWER(c.email) LIKE LOWER(CONCAT('%', :query, '%')) OR "
            + "c.phoneNumber LIKE CONCAT('%', :query, '%')) "
            + "ORDER BY c.createdAt DESC")
    List<Contact> search(@Param("userId") String userId, @Param("query") String query, Pageable pageable);
}
