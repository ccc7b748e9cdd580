package com.reviewflow.model;

public enum SubmissionStatus {
    PENDING,
    AI_REVIEWED,
    UNDER_PEER_REVIEW,
    FINALIZED,
    FLAGGED,
    REJECTED
}
