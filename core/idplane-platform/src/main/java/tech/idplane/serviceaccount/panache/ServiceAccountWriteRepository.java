package tech.idplane.serviceaccount.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.idplane.platform.shared.EntityType;
import tech.idplane.platform.shared.TsidGenerator;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.jpaentity.ServiceAccountJpaEntity;
import tech.idplane.serviceaccount.jpaentity.ServiceAccountRoleEntity;
import tech.idplane.serviceaccount.jpaentity.ServiceAccountScopeEntity;
import tech.idplane.serviceaccount.mapper.ServiceAccountMapper;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Write-side repository for ServiceAccount entities.
 * Extends PanacheRepositoryBase for entity persistence; association rows are
 * managed through the EntityManager.
 */
@ApplicationScoped
@Transactional
public class ServiceAccountWriteRepository implements PanacheRepositoryBase<ServiceAccountJpaEntity, String> {

    /**
     * Persist a new service account with its role and scope associations.
     */
    public void persistServiceAccount(ServiceAccount serviceAccount) {
        Instant now = Instant.now();
        if (serviceAccount.id == null) {
            serviceAccount.id = TsidGenerator.generate(EntityType.SERVICE_ACCOUNT);
        }
        if (serviceAccount.createdAt == null) {
            serviceAccount.createdAt = now;
        }
        serviceAccount.updatedAt = now;

        persist(ServiceAccountMapper.toEntity(serviceAccount));

        insertRoles(serviceAccount.id, serviceAccount.roleIds());
        insertScopes(serviceAccount.id, serviceAccount.scopeIds());
    }

    public void updateServiceAccount(ServiceAccount serviceAccount) {
        serviceAccount.updatedAt = Instant.now();

        ServiceAccountJpaEntity entity = findById(serviceAccount.id);
        if (entity != null) {
            ServiceAccountMapper.updateEntity(entity, serviceAccount);
        }
    }

    /**
     * Bring the role set to exactly {@code roleIds}: rows no longer wanted are removed,
     * missing rows are inserted and rows in both sets are left alone.
     */
    public void replaceRoles(String serviceAccountId, List<String> roleIds) {
        Set<String> wanted = new LinkedHashSet<>(roleIds != null ? roleIds : List.of());
        List<ServiceAccountRoleEntity> existing = getEntityManager().createQuery(
                "FROM ServiceAccountRoleEntity WHERE serviceAccountId = :id", ServiceAccountRoleEntity.class)
            .setParameter("id", serviceAccountId)
            .getResultList();
        for (ServiceAccountRoleEntity row : existing) {
            if (!wanted.remove(row.roleId)) {
                getEntityManager().remove(row);
            }
        }
        insertRoles(serviceAccountId, List.copyOf(wanted));
    }

    public void replaceScopes(String serviceAccountId, List<String> scopeIds) {
        Set<String> wanted = new LinkedHashSet<>(scopeIds != null ? scopeIds : List.of());
        List<ServiceAccountScopeEntity> existing = getEntityManager().createQuery(
                "FROM ServiceAccountScopeEntity WHERE serviceAccountId = :id", ServiceAccountScopeEntity.class)
            .setParameter("id", serviceAccountId)
            .getResultList();
        for (ServiceAccountScopeEntity row : existing) {
            if (!wanted.remove(row.scopeId)) {
                getEntityManager().remove(row);
            }
        }
        insertScopes(serviceAccountId, List.copyOf(wanted));
    }

    public boolean assignRole(String serviceAccountId, String roleId) {
        var key = new ServiceAccountRoleEntity.Key(serviceAccountId, roleId);
        if (getEntityManager().find(ServiceAccountRoleEntity.class, key) != null) {
            return false;
        }
        getEntityManager().persist(new ServiceAccountRoleEntity(serviceAccountId, roleId));
        return true;
    }

    public boolean removeRole(String serviceAccountId, String roleId) {
        return getEntityManager().createQuery(
                "DELETE FROM ServiceAccountRoleEntity WHERE serviceAccountId = :id AND roleId = :roleId")
            .setParameter("id", serviceAccountId)
            .setParameter("roleId", roleId)
            .executeUpdate() > 0;
    }

    public boolean assignScope(String serviceAccountId, String scopeId) {
        var key = new ServiceAccountScopeEntity.Key(serviceAccountId, scopeId);
        if (getEntityManager().find(ServiceAccountScopeEntity.class, key) != null) {
            return false;
        }
        getEntityManager().persist(new ServiceAccountScopeEntity(serviceAccountId, scopeId));
        return true;
    }

    public boolean removeScope(String serviceAccountId, String scopeId) {
        return getEntityManager().createQuery(
                "DELETE FROM ServiceAccountScopeEntity WHERE serviceAccountId = :id AND scopeId = :scopeId")
            .setParameter("id", serviceAccountId)
            .setParameter("scopeId", scopeId)
            .executeUpdate() > 0;
    }

    /**
     * Clear both association tables, then delete the owning row.
     */
    public boolean deleteWithAssociations(String id) {
        getEntityManager().createQuery("DELETE FROM ServiceAccountRoleEntity WHERE serviceAccountId = :id")
            .setParameter("id", id)
            .executeUpdate();
        getEntityManager().createQuery("DELETE FROM ServiceAccountScopeEntity WHERE serviceAccountId = :id")
            .setParameter("id", id)
            .executeUpdate();
        return deleteById(id);
    }

    private void insertRoles(String serviceAccountId, List<String> roleIds) {
        if (roleIds == null) {
            return;
        }
        for (String roleId : new LinkedHashSet<>(roleIds)) {
            getEntityManager().persist(new ServiceAccountRoleEntity(serviceAccountId, roleId));
        }
    }

    private void insertScopes(String serviceAccountId, List<String> scopeIds) {
        if (scopeIds == null) {
            return;
        }
        for (String scopeId : new LinkedHashSet<>(scopeIds)) {
            getEntityManager().persist(new ServiceAccountScopeEntity(serviceAccountId, scopeId));
        }
    }
}
