package com.reviewflow.model;

public enum XpTransactionType {
    SUBMISSION_REWARD,
    REVIEW_REWARD,
    PENALTY,
    ADMIN_ADJUSTMENT
}
