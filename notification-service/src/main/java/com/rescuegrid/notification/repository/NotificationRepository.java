package com.rescuegrid.notification.repository;

import com.rescuegrid.notification.entity.Notification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    boolean existsByDedupKey(String dedupKey);

    List<Notification> findAllByOrderByCreatedAtDesc();

    List<Notification> findByRecipientIdOrderByCreatedAtDesc(String recipientId);

    List<Notification> findByRecipientIdAndReadFalseOrderByCreatedAtDesc(String recipientId);

    long countByRecipientIdAndReadFalse(String recipientId);

    /** 수신자의 안 읽은 알림 일괄 읽음 처리 */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Notification n SET n.read = true, n.readAt = :readAt " +
            "WHERE n.recipientId = :recipientId AND n.read = false")
    int markAllAsRead(@Param("recipientId") String recipientId, @Param("readAt") LocalDateTime readAt);
}
