package tech.idplane.user.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import tech.idplane.user.entity.User;
import tech.idplane.user.jpaentity.UserJpaEntity;
import tech.idplane.user.jpaentity.UserRoleEntity;
import tech.idplane.user.mapper.UserMapper;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Write-side repository for User entities and their user_roles rows.
 */
@ApplicationScoped
@Transactional
public class UserWriteRepository implements PanacheRepositoryBase<UserJpaEntity, String> {

    public void persistUser(User user) {
        Instant now = Instant.now();
        if (user.createdAt == null) {
            user.createdAt = now;
        }
        user.updatedAt = now;
        persist(UserMapper.toEntity(user));
        insertRoles(user.id, user.roleIds());
    }

    public void updateUser(User user) {
        user.updatedAt = Instant.now();
        UserJpaEntity entity = findById(user.id);
        if (entity != null) {
            UserMapper.updateEntity(entity, user);
        }
    }

    public void replaceRoles(String userId, List<String> roleIds) {
        Set<String> wanted = new LinkedHashSet<>(roleIds != null ? roleIds : List.of());
        List<UserRoleEntity> existing = getEntityManager().createQuery(
                "FROM UserRoleEntity WHERE userId = :id", UserRoleEntity.class)
            .setParameter("id", userId)
            .getResultList();
        for (UserRoleEntity row : existing) {
            if (!wanted.remove(row.roleId)) {
                getEntityManager().remove(row);
            }
        }
        insertRoles(userId, List.copyOf(wanted));
    }

    public boolean assignRole(String userId, String roleId) {
        if (getEntityManager().find(UserRoleEntity.class, new UserRoleEntity.Key(userId, roleId)) != null) {
            return false;
        }
        getEntityManager().persist(new UserRoleEntity(userId, roleId));
        return true;
    }

    public boolean removeRole(String userId, String roleId) {
        return getEntityManager().createQuery(
                "DELETE FROM UserRoleEntity WHERE userId = :id AND roleId = :roleId")
            .setParameter("id", userId)
            .setParameter("roleId", roleId)
            .executeUpdate() > 0;
    }

    public boolean deleteWithRoles(String id) {
        getEntityManager().createQuery("DELETE FROM UserRoleEntity WHERE userId = :id")
            .setParameter("id", id)
            .executeUpdate();
        return deleteById(id);
    }

    private void insertRoles(String userId, List<String> roleIds) {
        if (roleIds == null) {
            return;
        }
        for (String roleId : new LinkedHashSet<>(roleIds)) {
            getEntityManager().persist(new UserRoleEntity(userId, roleId));
        }
    }
}
