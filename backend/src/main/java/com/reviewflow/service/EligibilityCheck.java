package com.reviewflow.service;

public record EligibilityCheck(boolean canAssign, String reason) {

    private static final EligibilityCheck ALLOWED = new EligibilityCheck(true, null);

    public static EligibilityCheck allowed() {
        return ALLOWED;
    }

    public static EligibilityCheck denied(String reason) {
        return new EligibilityCheck(false, reason);
    }
}
