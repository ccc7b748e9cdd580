package com.reviewflow.repository;

import com.reviewflow.model.Notification;
import com.reviewflow.model.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    boolean existsByUserIdAndTypeAndAssignmentIdAndReminderIntervalHours(UUID userId,
                                                                         NotificationType type,
                                                                         UUID assignmentId,
                                                                         Integer reminderIntervalHours);

    List<Notification> findByUserIdOrderByCreatedAtDesc(UUID userId);

    @Modifying
    @Query(value = "INSERT INTO notifications " +
            "(id, user_id, type, title, message, data, assignment_id, reminder_interval_hours, read, created_at) " +
            "VALUES (:id, :userId, :type, :title, :message, :data, :assignmentId, :interval, false, :createdAt) " +
            "ON CONFLICT (user_id, type, assignment_id, reminder_interval_hours) DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("type") String type,
                       @Param("title") String title,
                       @Param("message") String message,
                       @Param("data") String data,
                       @Param("assignmentId") UUID assignmentId,
                       @Param("interval") Integer interval,
                       @Param("createdAt") OffsetDateTime createdAt);
}
