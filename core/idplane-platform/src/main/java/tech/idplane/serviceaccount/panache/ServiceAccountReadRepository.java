package tech.idplane.serviceaccount.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.entity.RoleEntity;
import tech.idplane.platform.authorization.mapper.RoleMapper;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.entity.ScopeEntity;
import tech.idplane.platform.scope.mapper.ScopeMapper;
import tech.idplane.serviceaccount.entity.ServiceAccount;
import tech.idplane.serviceaccount.jpaentity.ServiceAccountJpaEntity;
import tech.idplane.serviceaccount.mapper.ServiceAccountMapper;
import tech.idplane.serviceaccount.repository.ServiceAccountFilter;
import tech.idplane.serviceaccount.repository.ServiceAccountRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-side repository for ServiceAccount entities.
 * Uses EntityManager directly to return domain objects; writes delegate to
 * {@link ServiceAccountWriteRepository}.
 */
@ApplicationScoped
public class ServiceAccountReadRepository implements ServiceAccountRepository {

    private static final String SEARCH_CLAUSE =
        " AND (LOWER(e.clientId) LIKE :search ESCAPE '\\'"
            + " OR LOWER(e.clientName) LIKE :search ESCAPE '\\'"
            + " OR LOWER(e.description) LIKE :search ESCAPE '\\')";

    @Inject
    EntityManager em;

    @Inject
    ServiceAccountWriteRepository writeRepo;

    @Override
    public Optional<ServiceAccount> findById(String id) {
        ServiceAccountJpaEntity entity = em.find(ServiceAccountJpaEntity.class, id);
        if (entity == null) {
            return Optional.empty();
        }
        return Optional.of(toDomainWithRelations(entity));
    }

    @Override
    public Optional<ServiceAccount> findByClientId(String clientId) {
        List<ServiceAccountJpaEntity> results = em.createQuery(
                "FROM ServiceAccountJpaEntity WHERE clientId = :clientId", ServiceAccountJpaEntity.class)
            .setParameter("clientId", clientId)
            .getResultList();
        return results.isEmpty() ? Optional.empty() : Optional.of(toDomainWithRelations(results.get(0)));
    }

    @Override
    public boolean existsByClientId(String clientId) {
        return em.createQuery(
                "SELECT COUNT(e) FROM ServiceAccountJpaEntity e WHERE e.clientId = :clientId", Long.class)
            .setParameter("clientId", clientId)
            .getSingleResult() > 0;
    }

    @Override
    public List<ServiceAccount> findWithFilter(ServiceAccountFilter filter) {
        TypedQuery<ServiceAccountJpaEntity> query = em.createQuery(
            "SELECT e FROM ServiceAccountJpaEntity e WHERE 1=1" + whereClause(filter) + " ORDER BY e.clientId",
            ServiceAccountJpaEntity.class);
        bind(query, filter);

        return query
            .setFirstResult(Math.max(filter.skip(), 0))
            .setMaxResults(filter.limit())
            .getResultList()
            .stream()
            .map(this::toDomainWithRelations)
            .toList();
    }

    @Override
    public long countWithFilter(ServiceAccountFilter filter) {
        TypedQuery<Long> query = em.createQuery(
            "SELECT COUNT(e) FROM ServiceAccountJpaEntity e WHERE 1=1" + whereClause(filter), Long.class);
        bind(query, filter);
        return query.getSingleResult();
    }

    @Override
    public List<ServiceAccount> listPage(String afterClientId, int limit) {
        TypedQuery<ServiceAccountJpaEntity> query = afterClientId == null
            ? em.createQuery("FROM ServiceAccountJpaEntity ORDER BY clientId", ServiceAccountJpaEntity.class)
            : em.createQuery("FROM ServiceAccountJpaEntity WHERE clientId > :after ORDER BY clientId",
                    ServiceAccountJpaEntity.class)
                .setParameter("after", afterClientId);
        return query
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(this::toDomainWithRelations)
            .toList();
    }

    @Override
    public List<ServiceAccount> findByRoleId(String roleId) {
        return em.createQuery(
                "SELECT e FROM ServiceAccountJpaEntity e, ServiceAccountRoleEntity sar "
                    + "WHERE sar.serviceAccountId = e.id AND sar.roleId = :roleId ORDER BY e.clientId",
                ServiceAccountJpaEntity.class)
            .setParameter("roleId", roleId)
            .getResultList()
            .stream()
            .map(this::toDomainWithRelations)
            .toList();
    }

    @Override
    public List<ServiceAccount> findByScopeId(String scopeId) {
        return em.createQuery(
                "SELECT e FROM ServiceAccountJpaEntity e, ServiceAccountScopeEntity sas "
                    + "WHERE sas.serviceAccountId = e.id AND sas.scopeId = :scopeId ORDER BY e.clientId",
                ServiceAccountJpaEntity.class)
            .setParameter("scopeId", scopeId)
            .getResultList()
            .stream()
            .map(this::toDomainWithRelations)
            .toList();
    }

    // Write operations delegate to WriteRepository
    @Override
    public void persist(ServiceAccount serviceAccount) {
        writeRepo.persistServiceAccount(serviceAccount);
    }

    @Override
    public void update(ServiceAccount serviceAccount) {
        writeRepo.updateServiceAccount(serviceAccount);
    }

    @Override
    public void replaceRoles(String serviceAccountId, List<String> roleIds) {
        writeRepo.replaceRoles(serviceAccountId, roleIds);
    }

    @Override
    public void replaceScopes(String serviceAccountId, List<String> scopeIds) {
        writeRepo.replaceScopes(serviceAccountId, scopeIds);
    }

    @Override
    public boolean assignRole(String serviceAccountId, String roleId) {
        return writeRepo.assignRole(serviceAccountId, roleId);
    }

    @Override
    public boolean removeRole(String serviceAccountId, String roleId) {
        return writeRepo.removeRole(serviceAccountId, roleId);
    }

    @Override
    public boolean assignScope(String serviceAccountId, String scopeId) {
        return writeRepo.assignScope(serviceAccountId, scopeId);
    }

    @Override
    public boolean removeScope(String serviceAccountId, String scopeId) {
        return writeRepo.removeScope(serviceAccountId, scopeId);
    }

    @Override
    public boolean deleteWithAssociations(String id) {
        return writeRepo.deleteWithAssociations(id);
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    private static String whereClause(ServiceAccountFilter filter) {
        StringBuilder where = new StringBuilder();
        if (filter.activeOnly()) {
            where.append(" AND e.active = true");
        }
        if (filter.hasSearch()) {
            where.append(SEARCH_CLAUSE);
        }
        return where.toString();
    }

    private static void bind(TypedQuery<?> query, ServiceAccountFilter filter) {
        if (filter.hasSearch()) {
            query.setParameter("search", "%" + escapeLike(filter.search().trim().toLowerCase(Locale.ROOT)) + "%");
        }
    }

    private static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private ServiceAccount toDomainWithRelations(ServiceAccountJpaEntity entity) {
        ServiceAccount base = ServiceAccountMapper.toDomain(entity);

        List<Role> roles = em.createQuery(
                "SELECT r FROM RoleEntity r, ServiceAccountRoleEntity sar "
                    + "WHERE sar.roleId = r.id AND sar.serviceAccountId = :id ORDER BY r.name",
                RoleEntity.class)
            .setParameter("id", entity.id)
            .getResultList()
            .stream()
            .map(r -> {
                release(r);
                return RoleMapper.toDomain(r);
            })
            .toList();

        List<Scope> scopes = em.createQuery(
                "SELECT s FROM ScopeEntity s, ServiceAccountScopeEntity sas "
                    + "WHERE sas.scopeId = s.id AND sas.serviceAccountId = :id ORDER BY s.name",
                ScopeEntity.class)
            .setParameter("id", entity.id)
            .getResultList()
            .stream()
            .map(s -> {
                release(s);
                return ScopeMapper.toDomain(s);
            })
            .toList();

        base.roles = new ArrayList<>(roles);
        base.scopes = new ArrayList<>(scopes);
        release(entity);
        return base;
    }

    /**
     * Outside a transaction reads go through the request-scoped session while writes
     * commit through their own transaction-scoped one. Anything left managed here would
     * be served stale to a later read in the same request, so it is detached.
     */
    private void release(Object entity) {
        if (!em.isJoinedToTransaction()) {
            em.detach(entity);
        }
    }
}
