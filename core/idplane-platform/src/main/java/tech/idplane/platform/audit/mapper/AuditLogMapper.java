package tech.idplane.platform.audit.mapper;

import tech.idplane.platform.audit.AuditLog;
import tech.idplane.platform.audit.entity.AuditLogEntity;

import java.time.Instant;

/**
 * Mapper for converting between AuditLog domain model and JPA entity.
 */
public final class AuditLogMapper {

    private AuditLogMapper() {
    }

    public static AuditLog toDomain(AuditLogEntity entity) {
        if (entity == null) {
            return null;
        }

        AuditLog domain = new AuditLog();
        domain.id = entity.id;
        domain.action = entity.action;
        domain.resourceType = entity.resourceType;
        domain.resourceId = entity.resourceId;
        domain.details = entity.details;
        domain.performedBy = entity.performedBy;
        domain.correlationId = entity.correlationId;
        domain.performedAt = entity.performedAt;
        return domain;
    }

    public static AuditLogEntity toEntity(AuditLog domain) {
        if (domain == null) {
            return null;
        }

        AuditLogEntity entity = new AuditLogEntity();
        entity.id = domain.id;
        entity.action = domain.action;
        entity.resourceType = domain.resourceType;
        entity.resourceId = domain.resourceId;
        entity.details = domain.details;
        entity.performedBy = domain.performedBy;
        entity.correlationId = domain.correlationId;
        entity.performedAt = domain.performedAt != null ? domain.performedAt : Instant.now();
        return entity;
    }
}
