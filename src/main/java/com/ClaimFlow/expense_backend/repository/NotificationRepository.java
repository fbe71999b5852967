package com.ClaimFlow.expense_backend.repository;

import com.ClaimFlow.expense_backend.model.Notification;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    Page<Notification> findByRecipient_IdOrderByCreatedAtDesc(UUID recipientId, Pageable pageable);

    Page<Notification> findByRecipient_IdAndReadFalseOrderByCreatedAtDesc(UUID recipientId, Pageable pageable);

    Optional<Notification> findByIdAndRecipient_Id(UUID id, UUID recipientId);

    long countByRecipient_IdAndReadFalse(UUID recipientId);

    long countByRecipient_Id(UUID recipientId);

    @Query("SELECT n.type, COUNT(n) FROM Notification n WHERE n.recipient.id = :recipientId GROUP BY n.type")
    List<Object[]> countByTypeForRecipient(@Param("recipientId") UUID recipientId);

    @Modifying
    @Query("DELETE FROM Notification n WHERE n.recipient.id = :recipientId")
    int deleteAllForRecipient(@Param("recipientId") UUID recipientId);

    @Modifying
    @Query("UPDATE Notification n SET n.read = true, n.readAt = :now " +
            "WHERE n.recipient.id = :recipientId AND n.read = false")
    int markAllRead(@Param("recipientId") UUID recipientId, @Param("now") LocalDateTime now);
}
