package tech.idplane.user.panache;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.persistence.EntityManager;
import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.entity.RoleEntity;
import tech.idplane.platform.authorization.mapper.RoleMapper;
import tech.idplane.user.entity.User;
import tech.idplane.user.jpaentity.UserJpaEntity;
import tech.idplane.user.mapper.UserMapper;
import tech.idplane.user.repository.UserRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Read-side repository for User aggregates; writes delegate to {@link UserWriteRepository}.
 * Entities read outside a transaction are detached once mapped, for the same reason as
 * in the service account read side.
 */
@ApplicationScoped
public class UserReadRepository implements UserRepository {

    @Inject
    EntityManager em;

    @Inject
    UserWriteRepository writeRepo;

    @Override
    public Optional<User> findById(String id) {
        UserJpaEntity entity = em.find(UserJpaEntity.class, id);
        return entity == null ? Optional.empty() : Optional.of(toDomainWithRoles(entity));
    }

    @Override
    public Optional<User> findByEmail(String email) {
        if (email == null) {
            return Optional.empty();
        }
        return em.createQuery("FROM UserJpaEntity WHERE LOWER(email) = :email", UserJpaEntity.class)
            .setParameter("email", email.trim().toLowerCase(Locale.ROOT))
            .getResultStream()
            .findFirst()
            .map(this::toDomainWithRoles);
    }

    @Override
    public boolean existsByEmail(String email) {
        if (email == null) {
            return false;
        }
        return em.createQuery("SELECT COUNT(u) FROM UserJpaEntity u WHERE LOWER(u.email) = :email", Long.class)
            .setParameter("email", email.trim().toLowerCase(Locale.ROOT))
            .getSingleResult() > 0;
    }

    @Override
    public List<User> list(int skip, int limit) {
        return em.createQuery("FROM UserJpaEntity ORDER BY email", UserJpaEntity.class)
            .setFirstResult(Math.max(skip, 0))
            .setMaxResults(limit)
            .getResultList()
            .stream()
            .map(this::toDomainWithRoles)
            .toList();
    }

    @Override
    public long count() {
        return em.createQuery("SELECT COUNT(u) FROM UserJpaEntity u", Long.class).getSingleResult();
    }

    @Override
    public List<User> findByRoleId(String roleId) {
        return em.createQuery(
                "SELECT u FROM UserJpaEntity u, UserRoleEntity ur "
                    + "WHERE ur.userId = u.id AND ur.roleId = :roleId ORDER BY u.email",
                UserJpaEntity.class)
            .setParameter("roleId", roleId)
            .getResultList()
            .stream()
            .map(this::toDomainWithRoles)
            .toList();
    }

    @Override
    public void persist(User user) {
        writeRepo.persistUser(user);
    }

    @Override
    public void update(User user) {
        writeRepo.updateUser(user);
    }

    @Override
    public void replaceRoles(String userId, List<String> roleIds) {
        writeRepo.replaceRoles(userId, roleIds);
    }

    @Override
    public boolean assignRole(String userId, String roleId) {
        return writeRepo.assignRole(userId, roleId);
    }

    @Override
    public boolean removeRole(String userId, String roleId) {
        return writeRepo.removeRole(userId, roleId);
    }

    @Override
    public boolean deleteWithRoles(String id) {
        return writeRepo.deleteWithRoles(id);
    }

    private User toDomainWithRoles(UserJpaEntity entity) {
        User user = UserMapper.toDomain(entity);
        List<Role> roles = em.createQuery(
                "SELECT r FROM RoleEntity r, UserRoleEntity ur "
                    + "WHERE ur.roleId = r.id AND ur.userId = :id ORDER BY r.name",
                RoleEntity.class)
            .setParameter("id", entity.id)
            .getResultList()
            .stream()
            .map(r -> {
                release(r);
                return RoleMapper.toDomain(r);
            })
            .toList();
        user.roles = new ArrayList<>(roles);
        release(entity);
        return user;
    }

    private void release(Object entity) {
        if (!em.isJoinedToTransaction()) {
            em.detach(entity);
        }
    }
}
