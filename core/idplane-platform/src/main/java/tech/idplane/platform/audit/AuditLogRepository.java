package tech.idplane.platform.audit;

import java.util.List;

/**
 * Repository for AuditLog entities.
 */
public interface AuditLogRepository {

    List<AuditLog> findByResource(String resourceType, String resourceId, int limit);

    List<AuditLog> findByResourceType(String resourceType, int limit);

    List<AuditLog> findRecent(int limit);

    long count();

    void persist(AuditLog auditLog);
}
