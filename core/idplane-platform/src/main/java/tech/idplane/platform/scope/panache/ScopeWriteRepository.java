package tech.idplane.platform.scope.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.idplane.platform.scope.Scope;
import tech.idplane.platform.scope.entity.ScopeEntity;
import tech.idplane.platform.scope.mapper.ScopeMapper;

import java.time.Instant;
import java.util.List;

/**
 * Write-side repository for Scope entities.
 */
@ApplicationScoped
@Transactional
public class ScopeWriteRepository implements PanacheRepositoryBase<ScopeEntity, String> {

    public void persistScope(Scope scope) {
        Instant now = Instant.now();
        if (scope.createdAt == null) {
            scope.createdAt = now;
        }
        scope.updatedAt = now;
        persist(ScopeMapper.toEntity(scope));
    }

    public void updateScope(Scope scope) {
        scope.updatedAt = Instant.now();
        ScopeEntity entity = findById(scope.id);
        if (entity != null) {
            entity.description = scope.description;
            entity.appliesTo = ScopeMapper.formatAppliesTo(scope.appliesTo);
            entity.active = scope.active;
            entity.updatedAt = scope.updatedAt;
        }
    }

    public void setActive(List<String> ids, boolean active) {
        if (ids.isEmpty()) {
            return;
        }
        update("active = ?1, updatedAt = ?2 WHERE id IN ?3", active, Instant.now(), ids);
    }

    /**
     * Remove the scope from every service account, then delete it.
     */
    public boolean deleteScope(String id) {
        getEntityManager().createQuery("DELETE FROM ServiceAccountScopeEntity WHERE scopeId = :id")
            .setParameter("id", id)
            .executeUpdate();
        return deleteById(id);
    }

    public void deleteScopes(List<String> ids) {
        if (ids.isEmpty()) {
            return;
        }
        getEntityManager().createQuery("DELETE FROM ServiceAccountScopeEntity WHERE scopeId IN :ids")
            .setParameter("ids", ids)
            .executeUpdate();
        delete("id IN ?1", ids);
    }
}
