package tech.idplane.platform.authorization.mapper;

import tech.idplane.platform.authorization.Role;
import tech.idplane.platform.authorization.entity.RoleEntity;

/**
 * Mapper between Role domain objects and RoleEntity.
 */
public final class RoleMapper {

    private RoleMapper() {
    }

    public static Role toDomain(RoleEntity entity) {
        if (entity == null) {
            return null;
        }
        Role role = new Role(entity.id, entity.name, entity.description);
        role.createdAt = entity.createdAt;
        role.updatedAt = entity.updatedAt;
        return role;
    }

    public static RoleEntity toEntity(Role domain) {
        if (domain == null) {
            return null;
        }
        RoleEntity entity = new RoleEntity();
        entity.id = domain.id;
        entity.name = domain.name;
        entity.description = domain.description;
        entity.createdAt = domain.createdAt;
        entity.updatedAt = domain.updatedAt;
        return entity;
    }
}
