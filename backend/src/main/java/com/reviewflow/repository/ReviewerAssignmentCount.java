package com.reviewflow.repository;

import java.util.UUID;

public interface ReviewerAssignmentCount {
    UUID getReviewerId();

    long getActiveCount();
}
