package tech.idplane.platform.authorization.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.entity.RoleEntity;
import tech.idplane.platform.authorization.mapper.RoleMapper;

import java.time.Instant;

/**
 * Write-side repository for Role entities.
 */
@ApplicationScoped
@Transactional
public class RoleWriteRepository implements PanacheRepositoryBase<RoleEntity, String> {

    public void persistRole(Role role) {
        Instant now = Instant.now();
        if (role.createdAt == null) {
            role.createdAt = now;
        }
        role.updatedAt = now;
        persist(RoleMapper.toEntity(role));
    }

    public void updateRole(Role role) {
        role.updatedAt = Instant.now();
        RoleEntity entity = findById(role.id);
        if (entity != null) {
            entity.name = role.name;
            entity.description = role.description;
            entity.updatedAt = role.updatedAt;
        }
    }

    /**
     * Remove the role from every service account and user, then delete it.
     */
    public boolean deleteRole(String id) {
        getEntityManager().createQuery("DELETE FROM ServiceAccountRoleEntity WHERE roleId = :id")
            .setParameter("id", id)
            .executeUpdate();
        getEntityManager().createQuery("DELETE FROM UserRoleEntity WHERE roleId = :id")
            .setParameter("id", id)
            .executeUpdate();
        return deleteById(id);
    }
}
