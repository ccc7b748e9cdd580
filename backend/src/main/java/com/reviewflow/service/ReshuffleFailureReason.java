package com.reviewflow.service;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ReshuffleFailureReason {
    NOT_FOUND("not_found"),
    ALREADY_PROCESSED("already_processed"),
    NO_REPLACEMENT_AVAILABLE("no_replacement_available");

    private final String code;

    ReshuffleFailureReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
