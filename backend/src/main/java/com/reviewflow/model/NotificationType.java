package com.reviewflow.model;

public enum NotificationType {
    REVIEW_ASSIGNED,
    DEADLINE_REMINDER,
    REVIEW_REASSIGNED,
    ADMIN_MESSAGE
}
