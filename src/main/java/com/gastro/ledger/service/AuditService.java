package com.gastro.ledger.service;

import com.gastro.ledger.model.AuditLog;
import com.gastro.ledger.repository.AuditLogRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Slf4j
@Service
public class AuditService {

    public static final String SYSTEM_USER = "SYSTEM";

    private final AuditLogRepository auditLogRepository;

    public AuditService(AuditLogRepository auditLogRepository) {
        this.auditLogRepository = auditLogRepository;
    }

    public void log(String action, String details) {
        try {
            AuditLog entry = new AuditLog();
            entry.setAction(action);
            entry.setDetails(details);

            var auth = SecurityContextHolder.getContext().getAuthentication();
            entry.setUsername(auth != null ? auth.getName() : SYSTEM_USER);

            auditLogRepository.save(entry);
        } catch (RuntimeException e) {
            // An audit failure must not abort the ledger operation
            log.error("Failed to write audit log for action {}: {}", action, e.getMessage());
        }
    }
}
