package com.reviewflow.gateway;

import java.util.Map;

/**
 * One audit-log line. Automated actions use {@link #SYSTEM_ADMIN_ID}.
 */
public record AdminAction(
        String adminId,
        String action,
        String targetType,
        String targetId,
        Map<String, Object> details
) {

    public static final String SYSTEM_ADMIN_ID = "system";

    public AdminAction {
        details = details == null ? Map.of() : details;
    }

    public static AdminAction system(String action, String targetType, String targetId, Map<String, Object> details) {
        return new AdminAction(SYSTEM_ADMIN_ID, action, targetType, targetId, details);
    }
}
