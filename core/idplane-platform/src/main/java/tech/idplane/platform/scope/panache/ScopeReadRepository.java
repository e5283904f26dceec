package tech.idplane.platform.scope.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.ScopeRepository;
import tech.idplane.platform.scope.entity.ScopeEntity;
import tech.idplane.platform.scope.mapper.ScopeMapper;

import java.util.List;
import java.util.Optional;

/**
 * Read-side repository for Scope entities.
 */
@ApplicationScoped
public class ScopeReadRepository implements ScopeRepository {

    @Inject
    EntityManager em;

    @Inject
    ScopeWriteRepository writeRepo;

    @Override
    public Optional<Scope> findById(String id) {
        return Optional.ofNullable(toDomain(em.find(ScopeEntity.class, id)));
    }

    @Override
    public Optional<Scope> findByName(String name) {
        return em.createQuery("FROM ScopeEntity WHERE name = :name", ScopeEntity.class)
            .setParameter("name", name)
            .getResultStream()
            .findFirst()
            .map(this::toDomain);
    }

    @Override
    public List<Scope> findByIds(List<String> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return em.createQuery("FROM ScopeEntity WHERE id IN :ids ORDER BY name", ScopeEntity.class)
            .setParameter("ids", ids)
            .getResultList()
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Override
    public List<Scope> listAll(boolean activeOnly) {
        String jpql = activeOnly
            ? "FROM ScopeEntity WHERE active = true ORDER BY name"
            : "FROM ScopeEntity ORDER BY name";
        return em.createQuery(jpql, ScopeEntity.class)
            .getResultList()
            .stream()
            .map(this::toDomain)
            .toList();
    }

    @Override
    public void persist(Scope scope) {
        writeRepo.persistScope(scope);
    }

    @Override
    public void update(Scope scope) {
        writeRepo.updateScope(scope);
    }

    @Override
    public void setActive(List<String> ids, boolean active) {
        writeRepo.setActive(ids, active);
    }

    @Override
    public boolean deleteWithAssignments(String id) {
        return writeRepo.deleteScope(id);
    }

    @Override
    public void deleteAllWithAssignments(List<String> ids) {
        writeRepo.deleteScopes(ids);
    }

    private Scope toDomain(ScopeEntity entity) {
        if (entity == null) {
            return null;
        }
        Scope scope = ScopeMapper.toDomain(entity);
        if (!em.isJoinedToTransaction()) {
            em.detach(entity);
        }
        return scope;
    }
}
