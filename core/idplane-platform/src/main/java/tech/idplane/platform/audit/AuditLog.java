package tech.idplane.platform.audit;

import java.time.Instant;

/**
 * Append-only audit entry written alongside every mutating operation.
 * Entries are never updated or deleted.
 */
public class AuditLog {

    public String id;

    /**
     * Event type of the operation, e.g. "iam:service-account:created".
     */
    public String action;

    public String resourceType;

    public String resourceId;

    /**
     * The executed command serialized as JSON. Secrets are excluded from serialization.
     */
    public String details;

    public String performedBy;

    public String correlationId;

    public Instant performedAt;

    public AuditLog() {
    }
}
