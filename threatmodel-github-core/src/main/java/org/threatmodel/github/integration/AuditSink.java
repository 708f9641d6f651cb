package org.threatmodel.github.integration;

/**
 * Destination for audit records. Implementations must be safe for concurrent use.
 */
public interface AuditSink {

	void appendAuditEvent(AuditEvent event);

}
