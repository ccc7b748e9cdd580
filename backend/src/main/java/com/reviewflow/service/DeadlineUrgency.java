package com.reviewflow.service;

public enum DeadlineUrgency {
    UPCOMING,
    URGENT,
    OVERDUE;

    public static DeadlineUrgency of(double hoursRemaining, double urgentThresholdHours) {
        if (hoursRemaining <= 0) {
            return OVERDUE;
        }
        if (hoursRemaining <= urgentThresholdHours) {
            return URGENT;
        }
        return UPCOMING;
    }
}
