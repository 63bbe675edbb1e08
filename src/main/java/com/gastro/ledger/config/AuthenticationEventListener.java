package com.gastro.ledger.config;

import com.gastro.ledger.service.AuditService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.security.authentication.event.AbstractAuthenticationFailureEvent;
import org.springframework.stereotype.Component;

/**
 * Audits failed HTTP basic logins. Successful ones are not recorded: with
 * stateless basic auth every request authenticates.
 */
@Slf4j
@Component
public class AuthenticationEventListener {

    private final AuditService auditService;

    public AuthenticationEventListener(AuditService auditService) {
        this.auditService = auditService;
    }

    @EventListener
    public void onFailure(AbstractAuthenticationFailureEvent event) {
        Object principal = event.getAuthentication().getPrincipal();
        String username = principal instanceof String ? (String) principal : "Unknown";
        String error = event.getException().getMessage();
        log.warn("Failed login for {}: {}", username, error);
        auditService.log("LOGIN_FAILURE", "Failed login for: " + username + " - " + error);
    }
}
