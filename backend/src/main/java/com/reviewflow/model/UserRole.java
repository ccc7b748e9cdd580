package com.reviewflow.model;

public enum UserRole {
    USER,
    REVIEWER,
    ADMIN
}
