package tech.idplane.user.mapper;

import tech.idplane.user.entity.User;
import tech.idplane.user.jpaentity.UserJpaEntity;

/**
 * Mapper between User domain objects and UserJpaEntity. Roles are loaded separately.
 */
public final class UserMapper {

    private UserMapper() {
    }

    public static User toDomain(UserJpaEntity entity) {
        if (entity == null) {
            return null;
        }
        User user = new User();
        user.id = entity.id;
        user.email = entity.email;
        user.passwordHash = entity.passwordHash;
        user.displayName = entity.displayName;
        user.active = entity.active;
        user.lastLoginAt = entity.lastLoginAt;
        user.failedLoginAttempts = entity.failedLoginAttempts;
        user.lockedUntil = entity.lockedUntil;
        user.createdAt = entity.createdAt;
        user.updatedAt = entity.updatedAt;
        return user;
    }

    public static UserJpaEntity toEntity(User domain) {
        if (domain == null) {
            return null;
        }
        UserJpaEntity entity = new UserJpaEntity();
        entity.id = domain.id;
        entity.createdAt = domain.createdAt;
        updateEntity(entity, domain);
        return entity;
    }

    /**
     * Copy every mutable column onto a managed entity.
     */
    public static void updateEntity(UserJpaEntity entity, User domain) {
        entity.email = domain.email;
        entity.passwordHash = domain.passwordHash;
        entity.displayName = domain.displayName;
        entity.active = domain.active;
        entity.lastLoginAt = domain.lastLoginAt;
        entity.failedLoginAttempts = domain.failedLoginAttempts;
        entity.lockedUntil = domain.lockedUntil;
        entity.updatedAt = domain.updatedAt;
    }
}
