package com.reviewflow.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * Reviewer-relevant projection of a platform user.
 * Preferences are read-only here; the profile service owns that column.
 */
@Getter
@Setter
@Entity
@Table(name = "users")
public class Reviewer {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "username", length = 64)
    private String username;

    @Column(name = "email", length = 320)
    private String email;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 16)
    private UserRole role = UserRole.USER;

    @Column(name = "total_xp", nullable = false)
    private Integer totalXp = 0;

    @Column(name = "current_week_xp", nullable = false)
    private Integer currentWeekXp = 0;

    @Column(name = "missed_reviews", nullable = false)
    private Integer missedReviews = 0;

    @Column(name = "review_paused_until")
    private OffsetDateTime reviewPausedUntil;

    @Column(name = "review_paused_permanently", nullable = false)
    private Boolean reviewPausedPermanently = false;

    @Convert(converter = ReviewerPreferencesConverter.class)
    @Column(name = "preferences", columnDefinition = "TEXT", updatable = false)
    private ReviewerPreferences preferences = ReviewerPreferences.NONE;

    @Column(name = "last_active_at")
    private OffsetDateTime lastActiveAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public String displayName() {
        if (username != null && !username.isBlank()) {
            return username;
        }
        if (email != null && email.contains("@")) {
            return email.substring(0, email.indexOf('@'));
        }
        return String.valueOf(id);
    }

    public boolean isPausedAt(OffsetDateTime now) {
        if (Boolean.TRUE.equals(reviewPausedPermanently)) {
            return true;
        }
        return reviewPausedUntil != null && reviewPausedUntil.isAfter(now);
    }
}
