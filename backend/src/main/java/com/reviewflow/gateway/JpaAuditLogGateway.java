package com.reviewflow.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reviewflow.model.AdminAuditLog;
import com.reviewflow.repository.AdminAuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class JpaAuditLogGateway implements AuditLogGateway {

    private static final Logger log = LoggerFactory.getLogger(JpaAuditLogGateway.class);

    private final AdminAuditLogRepository adminAuditLogRepository;
    private final ObjectMapper objectMapper;

    @Override
    public void logAdminAction(AdminAction action) {
        try {
            AdminAuditLog entry = new AdminAuditLog();
            entry.setId(UUID.randomUUID());
            entry.setAdminId(action.adminId());
            entry.setAction(action.action());
            entry.setTargetType(action.targetType());
            entry.setTargetId(action.targetId());
            entry.setDetails(objectMapper.writeValueAsString(action.details()));
            entry.setCreatedAt(OffsetDateTime.now());
            adminAuditLogRepository.save(entry);
        } catch (JsonProcessingException | RuntimeException ex) {
            log.warn("Failed to write audit log {} for {} {}", action.action(), action.targetType(), action.targetId(), ex);
        }
    }
}
