package com.reviewflow.repository;

import com.reviewflow.model.XpTransaction;
import com.reviewflow.model.XpTransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

@Repository
public interface XpTransactionRepository extends JpaRepository<XpTransaction, UUID> {

    boolean existsByUserIdAndTypeAndSourceId(UUID userId, XpTransactionType type, UUID sourceId);

    List<XpTransaction> findByUserIdOrderByCreatedAtAsc(UUID userId);

    /**
     * Inserts unless (user_id, source_id, type) is already taken; returns the inserted row count.
     */
    @Modifying
    @Query(value = "INSERT INTO xp_transactions (id, user_id, amount, type, description, source_id, created_at) " +
            "VALUES (:id, :userId, :amount, :type, :description, :sourceId, :createdAt) " +
            "ON CONFLICT (user_id, source_id, type) DO NOTHING",
            nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("userId") UUID userId,
                       @Param("amount") int amount,
                       @Param("type") String type,
                       @Param("description") String description,
                       @Param("sourceId") UUID sourceId,
                       @Param("createdAt") OffsetDateTime createdAt);
}
