package tech.idplane.platform.audit.entity;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * JPA Entity for audit_logs table.
 */
@Entity
@Table(name = "audit_logs", indexes = {
    @Index(name = "idx_audit_logs_resource", columnList = "resource_type, resource_id")
})
public class AuditLogEntity {

    @Id
    @Column(name = "id", length = 17)
    public String id;

    @Column(name = "action", nullable = false, length = 100)
    public String action;

    @Column(name = "resource_type", nullable = false, length = 50)
    public String resourceType;

    @Column(name = "resource_id", length = 255)
    public String resourceId;

    @Column(name = "details", length = 10000)
    public String details;

    @Column(name = "performed_by", length = 255)
    public String performedBy;

    @Column(name = "correlation_id", length = 100)
    public String correlationId;

    @Column(name = "performed_at", nullable = false)
    public Instant performedAt;

    public AuditLogEntity() {
    }
}
