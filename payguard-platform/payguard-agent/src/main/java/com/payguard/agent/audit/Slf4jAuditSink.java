package com.payguard.agent.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes audit entries to a dedicated logger, so the logging configuration
 * decides where the audit trail lands.
 */
public class Slf4jAuditSink implements AuditSink {

    private static final Logger audit = LoggerFactory.getLogger("payguard.audit");

    @Override
    public void write(AuditLog.AuditEntry entry) {
        AuditLog.AuditEvent event = entry.event();
        switch (event.severity()) {
            case HIGH, CRITICAL -> audit.warn("#{} [{}] {} {} {}", entry.sequenceNumber(), event.severity(),
                    event.type(), event.description(), event.details());
            default -> audit.info("#{} [{}] {} {} {}", entry.sequenceNumber(), event.severity(),
                    event.type(), event.description(), event.details());
        }
    }
}
