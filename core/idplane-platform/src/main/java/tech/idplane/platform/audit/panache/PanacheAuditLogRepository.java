package tech.idplane.platform.audit.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.transaction.Transactional;
import tech.idplane.platform.audit.AuditLog;
import tech.idplane.platform.audit.AuditLogRepository;
import tech.idplane.platform.audit.entity.AuditLogEntity;
import tech.idplane.platform.audit.mapper.AuditLogMapper;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;

import java.time.Instant;
import java.util.List;

/**
 * Panache-based implementation of AuditLogRepository.
 */
@ApplicationScoped
public class PanacheAuditLogRepository implements AuditLogRepository {

    @Inject
    EntityManager em;

    @Override
    public List<AuditLog> findByResource(String resourceType, String resourceId, int limit) {
        return em.createQuery(
                "FROM AuditLogEntity WHERE resourceType = :resourceType AND resourceId = :resourceId ORDER BY performedAt DESC",
                AuditLogEntity.class)
            .setParameter("resourceType", resourceType)
            .setParameter("resourceId", resourceId)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public List<AuditLog> findByResourceType(String resourceType, int limit) {
        return em.createQuery(
                "FROM AuditLogEntity WHERE resourceType = :resourceType ORDER BY performedAt DESC",
                AuditLogEntity.class)
            .setParameter("resourceType", resourceType)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public List<AuditLog> findRecent(int limit) {
        return em.createQuery("FROM AuditLogEntity ORDER BY performedAt DESC", AuditLogEntity.class)
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(AuditLogMapper::toDomain)
            .toList();
    }

    @Override
    public long count() {
        return em.createQuery("SELECT COUNT(a) FROM AuditLogEntity a", Long.class)
            .getSingleResult();
    }

    @Override
    @Transactional
    public void persist(AuditLog auditLog) {
        if (auditLog.id == null) {
            auditLog.id = TsidGenerator.generate(EntityType.AUDIT_LOG);
        }
        if (auditLog.performedAt == null) {
            auditLog.performedAt = Instant.now();
        }
        em.persist(AuditLogMapper.toEntity(auditLog));
    }
}
