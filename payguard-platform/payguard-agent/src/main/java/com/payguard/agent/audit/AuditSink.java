package com.payguard.agent.audit;

/**
 * Destination for audit entries outside the process (secure log file, platform event log).
 * Called synchronously for each appended entry.
 */
@FunctionalInterface
public interface AuditSink {

    void write(AuditLog.AuditEntry entry);
}
