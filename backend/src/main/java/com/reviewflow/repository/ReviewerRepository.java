package com.reviewflow.repository;

import com.reviewflow.model.Reviewer;
import com.reviewflow.model.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ReviewerRepository extends JpaRepository<Reviewer, UUID> {

    List<Reviewer> findByRoleIn(Collection<UserRole> roles);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.missedReviews = r.missedReviews + 1, r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId")
    int incrementMissedReviews(@Param("reviewerId") UUID reviewerId,
                               @Param("updatedAt") OffsetDateTime updatedAt);

    @Query("SELECT r.missedReviews FROM Reviewer r WHERE r.id = :reviewerId")
    Integer findMissedReviewsById(@Param("reviewerId") UUID reviewerId);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.totalXp = r.totalXp + :delta, " +
            "r.currentWeekXp = r.currentWeekXp + :delta, " +
            "r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId")
    int applyXpDelta(@Param("reviewerId") UUID reviewerId,
                     @Param("delta") int delta,
                     @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.reviewPausedUntil = :pausedUntil, r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId")
    int pauseReviewingUntil(@Param("reviewerId") UUID reviewerId,
                            @Param("pausedUntil") OffsetDateTime pausedUntil,
                            @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.reviewPausedPermanently = true, r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId")
    int banFromReviewing(@Param("reviewerId") UUID reviewerId,
                         @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.totalXp = 0, r.currentWeekXp = 0, r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId AND r.totalXp < 0")
    int clampNegativeTotalXp(@Param("reviewerId") UUID reviewerId,
                             @Param("updatedAt") OffsetDateTime updatedAt);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Reviewer r " +
            "SET r.currentWeekXp = 0, r.updatedAt = :updatedAt " +
            "WHERE r.id = :reviewerId AND r.currentWeekXp < 0")
    int clampNegativeCurrentWeekXp(@Param("reviewerId") UUID reviewerId,
                                   @Param("updatedAt") OffsetDateTime updatedAt);
}
