package com.reviewflow.model;

import java.time.OffsetDateTime;
import java.util.Set;

/**
 * Reviewer-relevant slice of the user's preferences blob.
 */
public record ReviewerPreferences(
        boolean optedOut,
        OffsetDateTime optedOutUntil,
        Set<String> taskTypes
) {

    public static final ReviewerPreferences NONE = new ReviewerPreferences(false, null, Set.of());

    public ReviewerPreferences {
        taskTypes = taskTypes == null ? Set.of() : Set.copyOf(taskTypes);
    }

    /**
     * An unexpired opt-out-until wins over the flag; otherwise the flag decides.
     */
    public boolean isOptedOutAt(OffsetDateTime now) {
        if (optedOutUntil != null && optedOutUntil.isAfter(now)) {
            return true;
        }
        return optedOut;
    }

    public boolean acceptsAnyTaskType(Set<String> requestedTaskTypes) {
        if (requestedTaskTypes == null || requestedTaskTypes.isEmpty() || taskTypes.isEmpty()) {
            return true;
        }
        for (String requested : requestedTaskTypes) {
            if (taskTypes.contains(requested)) {
                return true;
            }
        }
        return false;
    }
}
