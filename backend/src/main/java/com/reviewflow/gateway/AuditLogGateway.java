package com.reviewflow.gateway;

/**
 * Best-effort admin audit trail; implementations must not throw.
 */
public interface AuditLogGateway {

    void logAdminAction(AdminAction action);
}
